package tinytalk.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("拼写建议")
class SuggestionsTest {

    @Test
    @DisplayName("编辑距离")
    void testLevenshtein() {
        assertEquals(0, Suggestions.levenshtein("abc", "abc"));
        assertEquals(3, Suggestions.levenshtein("", "abc"));
        assertEquals(2, Suggestions.levenshtein("score", "scroe"));
        assertEquals(3, Suggestions.levenshtein("kitten", "sitting"));
    }

    @Test
    @DisplayName("取最接近的候选")
    void testClosest() {
        assertEquals("score", Suggestions.closest("scroe", Arrays.asList("total", "score", "show")));
        assertEquals("Count", Suggestions.closest("count", Collections.singletonList("Count")));
        assertNull(Suggestions.closest("zzzzzz", Arrays.asList("score", "show")));
    }

    @Test
    @DisplayName("未定义变量消息")
    void testUndefinedVariable() {
        assertEquals("Undefined variable 'scroe'. Did you mean 'score'?",
                Suggestions.undefinedVariable("scroe", Collections.singletonList("score")));
        assertEquals("Undefined variable 'q'", Suggestions.undefinedVariable("q", Collections.<String>emptyList()));
    }
}
