package com.vidnyan.guard.domain.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathPatternTest {

    @Test
    void trailingDoubleStar_ShouldMatchDirectoryAndEverythingBelow() {
        PathPattern pattern = PathPattern.of("components/**");

        assertTrue(pattern.matches("components"));
        assertTrue(pattern.matches("components/button"));
        assertTrue(pattern.matches("components/ui/forms/input"));
        assertFalse(pattern.matches("app/page"));
        assertFalse(pattern.matches("components-legacy/button"));
    }

    @Test
    void leadingDoubleStar_ShouldMatchAnyDepthIncludingZero() {
        PathPattern pattern = PathPattern.of("**/ui/**");

        assertTrue(pattern.matches("ui/button"));
        assertTrue(pattern.matches("components/ui/button"));
        assertFalse(pattern.matches("components/uix/button"));
    }

    @Test
    void singleStar_ShouldStayWithinOneSegment() {
        PathPattern pattern = PathPattern.of("lib/*");

        assertTrue(pattern.matches("lib/utils"));
        assertFalse(pattern.matches("lib/supabase/client"));
    }

    @Test
    void questionMark_ShouldMatchOneCharacter() {
        PathPattern pattern = PathPattern.of("app/pag?");

        assertTrue(pattern.matches("app/page"));
        assertFalse(pattern.matches("app/pages"));
    }

    @Test
    void literalCharacters_ShouldNotBeTreatedAsRegex() {
        assertTrue(PathPattern.of("@supabase/supabase-js").matches("@supabase/supabase-js"));
        assertFalse(PathPattern.of("lodash.get").matches("lodashxget"));
    }

    @Test
    void specificity_ShouldCountLiteralCharacters() {
        assertEquals(11, PathPattern.of("components/**").specificity());
        assertEquals(0, PathPattern.of("**").specificity());
        assertTrue(PathPattern.of("components/ui/**").specificity() > PathPattern.of("components/**").specificity());
    }

    @Test
    void blankPattern_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> PathPattern.of(" "));
    }
}
