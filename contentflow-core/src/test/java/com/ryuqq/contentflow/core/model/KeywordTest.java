package com.ryuqq.contentflow.core.model;

import com.ryuqq.contentflow.core.exception.WorkflowValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Keyword Value Object 테스트.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
class KeywordTest {

    @Test
    void of_ValidValue_TrimsWhitespace() {
        // When
        Keyword keyword = Keyword.of("  diabetes management  ");

        // Then
        assertEquals("diabetes management", keyword.getValue());
    }

    @Test
    void of_EmptyValue_ThrowsValidationException() {
        // When & Then
        WorkflowValidationException exception = assertThrows(
            WorkflowValidationException.class,
            () -> Keyword.of("")
        );
        assertEquals("Keyword cannot be empty", exception.getMessage());
    }

    @Test
    void of_WhitespaceOnly_ThrowsValidationException() {
        // When & Then
        WorkflowValidationException exception = assertThrows(
            WorkflowValidationException.class,
            () -> Keyword.of(" \t\n ")
        );
        assertEquals("Keyword cannot be empty", exception.getMessage());
    }

    @Test
    void of_NullValue_ThrowsValidationException() {
        // When & Then
        assertThrows(WorkflowValidationException.class, () -> Keyword.of(null));
    }

    @Test
    void of_ExactlyMaxLength_Succeeds() {
        // Given
        String value = "a".repeat(Keyword.MAX_LENGTH);

        // When
        Keyword keyword = Keyword.of(value);

        // Then
        assertEquals(200, keyword.getValue().length());
    }

    @Test
    void of_TooLong_ThrowsValidationExceptionWithLength() {
        // When & Then
        WorkflowValidationException exception = assertThrows(
            WorkflowValidationException.class,
            () -> Keyword.of("a".repeat(201))
        );
        assertEquals("Keyword too long: 201 characters (max 200)", exception.getMessage());
    }

    @Test
    void of_LongOnlyBecauseOfPadding_Succeeds() {
        // 앞뒤 공백 제거 후 길이 기준
        Keyword keyword = Keyword.of("   " + "b".repeat(200) + "   ");

        assertEquals(200, keyword.getValue().length());
    }

    @Test
    void sanitized_ReplacesSpacesAndPunctuation() {
        assertEquals("diabetes_management", Keyword.of("diabetes management").sanitized());
        assertEquals("what_is_AI_", Keyword.of("what is AI?").sanitized());
        assertEquals("a_b_c", Keyword.of("a/b\\c").sanitized());
    }

    @Test
    void sanitized_KeepsHyphenUnderscoreAndUnicodeLetters() {
        assertEquals("low-carb_diet", Keyword.of("low-carb_diet").sanitized());
        assertEquals("당뇨_관리", Keyword.of("당뇨 관리").sanitized());
    }

    @Test
    void equals_SameTrimmedValue_AreEqual() {
        // Given
        Keyword a = Keyword.of("seo");
        Keyword b = Keyword.of(" seo ");

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
