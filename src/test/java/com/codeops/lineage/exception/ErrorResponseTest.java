package com.codeops.lineage.exception;

import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ErrorResponse classification of escaped failures.
 */
class ErrorResponseTest {

    @Test
    void from_lineageException_keepsKindAndMessage() {
        ErrorResponse response = ErrorResponse.from(new DuplicateBranchException("Branch already exists: feature"));

        assertThat(response.kind()).isEqualTo(ErrorKind.DUPLICATE_BRANCH);
        assertThat(response.message()).isEqualTo("Branch already exists: feature");
    }

    @Test
    void from_optimisticLockFailure_isWriteConflict() {
        ErrorResponse response = ErrorResponse.from(
                new ObjectOptimisticLockingFailureException("ModuleVersion", "id"));

        assertThat(response.kind()).isEqualTo(ErrorKind.WRITE_CONFLICT);
    }

    @Test
    void from_constraintViolation_isInvalidArgument() {
        ErrorResponse response = ErrorResponse.from(new ConstraintViolationException("slug: must not be blank", Set.of()));

        assertThat(response.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(response.message()).contains("slug");
    }

    @Test
    void from_storeFailure_isUnknownWithoutLeakingDetail() {
        ErrorResponse response = ErrorResponse.from(new DataIntegrityViolationException("duplicate key uk_commits_hash"));

        assertThat(response.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(response.message()).doesNotContain("uk_commits_hash");
    }
}
