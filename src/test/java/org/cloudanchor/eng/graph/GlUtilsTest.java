package org.cloudanchor.eng.graph;

import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.lwjgl.opengl.GL30.*;

class GlUtilsTest {

    private static IntSupplier errors(Integer... codes) {
        Deque<Integer> pending = new ArrayDeque<>(Arrays.asList(codes));
        return () -> pending.isEmpty() ? GL_NO_ERROR : pending.poll();
    }

    @Test
    void noErrorPasses() {
        assertDoesNotThrow(() -> GlUtils.checkGlError("glDrawArrays", errors()));
    }

    @Test
    void pendingErrorsAreFatal() {
        GlException excp = assertThrows(GlException.class,
                () -> GlUtils.checkGlError("glAttachShader", errors(GL_INVALID_VALUE, GL_INVALID_OPERATION)));
        assertTrue(excp.getMessage().contains("glAttachShader"));
        assertTrue(excp.getMessage().contains("GL_INVALID_VALUE"));
        assertTrue(excp.getMessage().contains("GL_INVALID_OPERATION"));
    }

    @Test
    void stickyErrorDoesNotLoopForever() {
        assertThrows(GlException.class, () -> GlUtils.checkGlError("glClear", () -> GL_OUT_OF_MEMORY));
    }

    @Test
    void failedConditionIsFatal() {
        assertDoesNotThrow(() -> GlUtils.check(true, "texture bound"));
        GlException excp = assertThrows(GlException.class, () -> GlUtils.check(false, "texture bound"));
        assertTrue(excp.getMessage().contains("texture bound"));
    }

    @Test
    void errorNames() {
        assertEquals("GL_INVALID_ENUM", GlUtils.errorName(GL_INVALID_ENUM));
        assertEquals("GL_INVALID_FRAMEBUFFER_OPERATION", GlUtils.errorName(GL_INVALID_FRAMEBUFFER_OPERATION));
        assertEquals("0x1234", GlUtils.errorName(0x1234));
    }
}
