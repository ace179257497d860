package com.telemetry.domain.service;

import com.telemetry.domain.model.IssueReport;
import com.telemetry.domain.model.IssueType;
import com.telemetry.domain.service.extract.Fingerprints;
import com.telemetry.infrastructure.persistence.repository.IssueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IssueTrackingServiceTest {

    private static final UUID PROJECT_ID = UUID.fromString("7b1e8f1c-0000-4000-8000-000000000001");
    private static final Instant SEEN_AT = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private IssueRepository issueRepository;

    private IssueTrackingService service;

    @BeforeEach
    void setUp() {
        service = new IssueTrackingService(issueRepository);
    }

    @Test
    void testTrack_ErrorsWithDifferentNumbersShareFingerprint() {
        // Given
        IssueReport first = error("Order 1234 failed");
        IssueReport second = error("Order 98 failed");

        // When
        service.track(first);
        service.track(second);

        // Then
        String expected = Fingerprints.sha256("error:NetworkError:order N failed");
        verify(issueRepository, times(2)).recordOccurrence(
                eq(PROJECT_ID), eq(expected), eq("error"), eq("NetworkError"),
                anyString(), any(), eq("session-1"), any(), eq(SEEN_AT));
    }

    @Test
    void testTrack_AnrUsesThreadStateFrames() {
        // Given
        IssueReport report = IssueReport.builder()
                .projectId(PROJECT_ID)
                .sessionId("session-1")
                .type(IssueType.ANR)
                .name("ANR")
                .message("App not responding for 5000ms")
                .stackTrace("Thread Stack:\n0 [UIView layoutSubviews]\nPC: 0x1")
                .timestamp(SEEN_AT)
                .build();
        ArgumentCaptor<String> fingerprint = ArgumentCaptor.forClass(String.class);

        // When
        service.track(report);

        // Then
        verify(issueRepository).recordOccurrence(eq(PROJECT_ID), fingerprint.capture(), eq("anr"), eq("ANR"),
                any(), any(), any(), any(), any());
        assertEquals(Fingerprints.sha256("anr:ANR:[UIView layoutSubviews]"), fingerprint.getValue());
    }

    @Test
    void testTrack_DatabaseErrorIsLoggedNotThrown() {
        // Given
        when(issueRepository.recordOccurrence(any(), any(), any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new QueryTimeoutException("timeout"));

        // When / Then
        assertDoesNotThrow(() -> service.track(error("boom")));
    }

    private static IssueReport error(String message) {
        return IssueReport.builder()
                .projectId(PROJECT_ID)
                .sessionId("session-1")
                .type(IssueType.ERROR)
                .name("NetworkError")
                .message(message)
                .timestamp(SEEN_AT)
                .build();
    }
}
