package com.phillippitts.graphicrecorder.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorSanitizerTest {

    @Test
    void passesPlainMessagesThrough() {
        assertThat(ErrorSanitizer.sanitize(new IllegalStateException("Rate limit exceeded")))
                .isEqualTo("Rate limit exceeded");
    }

    @Test
    void nullOrBlankBecomesGeneric() {
        assertThat(ErrorSanitizer.sanitize((Throwable) null)).isEqualTo(ErrorSanitizer.UNEXPECTED);
        assertThat(ErrorSanitizer.sanitize(new RuntimeException())).isEqualTo(ErrorSanitizer.UNEXPECTED);
        assertThat(ErrorSanitizer.sanitize("   ")).isEqualTo(ErrorSanitizer.UNEXPECTED);
    }

    @Test
    void hidesPathsOsErrorsAndKeys() {
        assertThat(ErrorSanitizer.sanitize("ENOENT: no such file")).isEqualTo(ErrorSanitizer.INTERNAL);
        assertThat(ErrorSanitizer.sanitize("open /var/lib/app/db failed")).isEqualTo(ErrorSanitizer.INTERNAL);
        assertThat(ErrorSanitizer.sanitize("C:\\data\\db")).isEqualTo(ErrorSanitizer.INTERNAL);
        assertThat(ErrorSanitizer.sanitize("invalid api_key provided")).isEqualTo(ErrorSanitizer.INTERNAL);
        assertThat(ErrorSanitizer.sanitize("API key expired")).isEqualTo(ErrorSanitizer.INTERNAL);
    }

    @Test
    void truncatesLongMessages() {
        String sanitized = ErrorSanitizer.sanitize("x".repeat(500));

        assertThat(sanitized).hasSize(ErrorSanitizer.MAX_LENGTH + 3).endsWith("...");
    }

    @Test
    void unwrapsAsyncWrappers() {
        Throwable wrapped = new CompletionException(new ExecutionException(new IllegalStateException("quota")));

        assertThat(ErrorSanitizer.sanitize(wrapped)).isEqualTo("quota");
    }
}
