package com.telemetry.domain.service.extract;

import com.telemetry.domain.model.ArtifactKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ArtifactExtractorRegistry {

    private final EventsArtifactExtractor eventsExtractor;
    private final CrashArtifactExtractor crashExtractor;
    private final AnrArtifactExtractor anrExtractor;
    private final ReplayArtifactRecoveryExtractor replayRecoveryExtractor;

    public ArtifactExtractor forKind(ArtifactKind kind) {
        return switch (kind) {
            case EVENTS -> eventsExtractor;
            case CRASHES -> crashExtractor;
            case ANRS -> anrExtractor;
            case SCREENSHOTS, HIERARCHY -> replayRecoveryExtractor;
        };
    }
}
