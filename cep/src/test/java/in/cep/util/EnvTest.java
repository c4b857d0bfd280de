package in.cep.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "CEP_TEST_ENV_VALUE";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void get_fallsBackToDefaultAndTrims() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        System.setProperty(KEY, "  value ");
        assertEquals("value", Env.get(KEY, "fallback"));
    }

    @Test
    void getInt_isLenient() {
        System.setProperty(KEY, "abc");
        assertEquals(7, Env.getInt(KEY, 7));
    }

    @Test
    void requireLong_isStrict() {
        assertEquals(5, Env.requireLong(KEY, 5));
        System.setProperty(KEY, "12");
        assertEquals(12, Env.requireLong(KEY, 5));
        System.setProperty(KEY, "12x");
        assertThrows(IllegalStateException.class, () -> Env.requireLong(KEY, 5));
    }

    @Test
    void requireDouble_rejectsNaN() {
        System.setProperty(KEY, "NaN");
        assertThrows(IllegalStateException.class, () -> Env.requireDouble(KEY, 1.0));
        System.setProperty(KEY, "0.25");
        assertEquals(0.25, Env.requireDouble(KEY, 1.0));
    }

    @Test
    void requireBool_acceptsCommonSpellings() {
        System.setProperty(KEY, "YES");
        assertTrue(Env.requireBool(KEY, false));
        System.setProperty(KEY, "0");
        assertFalse(Env.requireBool(KEY, true));
        System.setProperty(KEY, "maybe");
        assertThrows(IllegalStateException.class, () -> Env.requireBool(KEY, true));
    }
}
