package com.javainsight.engine.model;

import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.TextRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InsightModelTest {

    private static MethodDecl method(int start, int end, Integer bodyStart, Integer bodyEnd) {
        return new MethodDecl("f", 0, Visibility.PACKAGE, false, 1, "void f()", start, end, bodyStart, bodyEnd);
    }

    @Test
    void methodWithAndWithoutBody() {
        assertTrue(method(0, 20, 10, 20).hasBody());
        assertFalse(method(0, 10, null, null).hasBody());
    }

    @Test
    void methodNeedsBothBodyOffsetsOrNeither() {
        assertThrows(IllegalArgumentException.class, () -> method(0, 20, 10, null));
        assertThrows(IllegalArgumentException.class, () -> method(0, 20, null, 20));
    }

    @Test
    void methodBodyCannotEndBeforeItStarts() {
        assertThrows(IllegalArgumentException.class, () -> method(0, 20, 15, 12));
    }

    @Test
    void methodCannotEndBeforeItStarts() {
        assertThrows(IllegalArgumentException.class, () -> method(30, 20, null, null));
    }

    @Test
    void emptyRangeIsAllowed() {
        TextRange range = new TextRange(5, 5);
        assertEquals(5, range.startOffset());
        assertEquals(5, range.endOffset());
    }

    @Test
    void rangeRejectsNegativeStartAndInversion() {
        assertThrows(IllegalArgumentException.class, () -> new TextRange(-1, 4));
        assertThrows(IllegalArgumentException.class, () -> new TextRange(8, 3));
    }
}
