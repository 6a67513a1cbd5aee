package org.verifythat.util;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReflectionUtilsTest {

    // ── Hidden JDK implementations ─────────────────────────────────────────

    @Test
    void immutableListMethods_resolveToAPublicDeclaration() {
        Method contains = ReflectionUtils.findMethod(List.of(1, 2, 3).getClass(), "contains", false, List.of(Object.class));

        assertThat(Modifier.isPublic(contains.getDeclaringClass().getModifiers())).isTrue();
        assertThat(contains.getDeclaringClass()).isIn(List.class, Collection.class);
    }

    @Test
    void arrayBackedListMethods_resolveToAPublicDeclaration() {
        Method size = ReflectionUtils.findMethod(Arrays.asList(1, 2).getClass(), "size", false, List.of());

        assertThat(Modifier.isPublic(size.getDeclaringClass().getModifiers())).isTrue();
        assertThat(size.getDeclaringClass().isAssignableFrom(List.class)).isTrue();
    }

    @Test
    void immutableMapMethods_resolveToAPublicDeclaration() {
        Method get = ReflectionUtils.findMethod(Map.of("a", 1).getClass(), "get", false, List.of(Object.class));

        assertThat(Modifier.isPublic(get.getDeclaringClass().getModifiers())).isTrue();
        assertThat(get.getDeclaringClass().getPackageName()).isEqualTo("java.util");
    }

    @Test
    void gettersOfHiddenImplementations_resolveToAPublicDeclaration() {
        Method isEmpty = ReflectionUtils.findGetter(List.of().getClass(), "empty", false);

        assertThat(isEmpty.getName()).isEqualTo("isEmpty");
        assertThat(Modifier.isPublic(isEmpty.getDeclaringClass().getModifiers())).isTrue();
    }

    // ── Own classes ────────────────────────────────────────────────────────

    @Test
    void methodsOfOpenPackages_areKeptAsDeclared() throws NoSuchMethodException {
        Method secret = Hidden.class.getDeclaredMethod("secret");

        assertThat(ReflectionUtils.accessibleMethod(secret)).isSameAs(secret);
        assertThat(ReflectionUtils.findMethod(Hidden.class, "secret", false, List.of())).isEqualTo(secret);
    }

    private static final class Hidden {

        private int secret() {
            return 42;
        }
    }
}
