package com.scidbshim.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class ShimStatusTest {

    @Test
    @DisplayName("Codes keep their wire values")
    void codesAreStable() {
        assertThat(ShimStatus.CONNECTION_SUCCESSFUL.getCode()).isZero();
        assertThat(ShimStatus.ERROR_CANT_CONNECT.getCode()).isEqualTo(-1);
        assertThat(ShimStatus.ERROR_AUTHENTICATION.getCode()).isEqualTo(-2);
        assertThat(ShimStatus.PREPARATION_SUCCESS.getCode()).isZero();
        assertThat(ShimStatus.NO_QUERY_RESULT_OBJ.getCode()).isEqualTo(-1);
        assertThat(ShimStatus.PREPARATION_ERROR.getCode()).isEqualTo(-2);
        assertThat(ShimStatus.EXECUTION_SUCCESS.getCode()).isZero();
        assertThat(ShimStatus.TRANSACTION_ROLLBACK.getCode()).isEqualTo(-3);
        assertThat(ShimStatus.EXECUTION_ERROR.getCode()).isEqualTo(-4);
        assertThat(ShimStatus.COMPLETION_SUCCESS.getCode()).isZero();
        assertThat(ShimStatus.COMPLETION_INVALID.getCode()).isEqualTo(-5);
        assertThat(ShimStatus.COMPLETION_ERROR.getCode()).isEqualTo(-6);
        assertThat(ShimStatus.NO_SCIDB_CONNECTION.getCode()).isEqualTo(-7);
        assertThat(ShimStatus.IO_ERROR.getCode()).isEqualTo(-8);
    }

    @Test
    @DisplayName("Rollback and invalid completion are not user-visible failures")
    void successShapedStatuses() {
        EnumSet<ShimStatus> quiet = EnumSet.of(
                ShimStatus.CONNECTION_SUCCESSFUL,
                ShimStatus.PREPARATION_SUCCESS,
                ShimStatus.EXECUTION_SUCCESS,
                ShimStatus.COMPLETION_SUCCESS,
                ShimStatus.TRANSACTION_ROLLBACK,
                ShimStatus.COMPLETION_INVALID);

        for (ShimStatus s : ShimStatus.values()) {
            assertThat(s.isUserVisibleFailure()).as(s.name()).isEqualTo(!quiet.contains(s));
        }
        assertThat(ShimStatus.TRANSACTION_ROLLBACK.isSuccess()).isFalse();
        assertThat(ShimStatus.COMPLETION_SUCCESS.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Every failure kind maps back from its status")
    void failureRoundTrip() {
        for (ShimFailure f : ShimFailure.values()) {
            assertThat(ShimFailure.fromStatus(f.getStatus())).isEqualTo(f);
        }
        assertThat(ShimFailure.fromStatus(ShimStatus.EXECUTION_SUCCESS)).isNull();
        assertThat(ShimFailure.fromStatus(ShimStatus.COMPLETION_INVALID)).isNull();
        assertThat(ShimFailure.fromStatus(null)).isNull();
    }

    @Test
    @DisplayName("Exception message names the code, status and phase")
    void exceptionMessage() {
        ShimQueryException auth = new ShimQueryException(ShimStatus.ERROR_AUTHENTICATION, "bad password");
        assertThat(auth.getMessage())
                .isEqualTo("error code -2 (ERROR_AUTHENTICATION) encountered during SciDB connection; message: bad password");
        assertThat(auth.getFailure()).isEqualTo(ShimFailure.AUTHENTICATION_FAILURE);

        ShimQueryException exec = new ShimQueryException(ShimStatus.EXECUTION_ERROR, "");
        assertThat(exec.getMessage()).isEqualTo("error code -4 (EXECUTION_ERROR) encountered during SciDB query");
        assertThat(exec.getCode()).isEqualTo(-4);
    }
}
