package io.github.drompincen.worktrack.gateway.controller;

import io.github.drompincen.worktrack.persistence.document.CaptureCommandDocument;
import io.github.drompincen.worktrack.persistence.repository.CaptureCommandRepository;
import io.github.drompincen.worktrack.protocol.api.CaptureCommandDto;
import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.CommandStatus;
import io.github.drompincen.worktrack.protocol.api.CreateCaptureCommandRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CaptureCommandControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-05T11:00:00Z");

    @Mock private CaptureCommandRepository commandRepository;

    private CaptureCommandController controller;

    @BeforeEach
    void setUp() {
        controller = new CaptureCommandController(commandRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createQueuesPendingCommand() {
        when(commandRepository.save(any(CaptureCommandDocument.class))).thenAnswer(inv -> {
            CaptureCommandDocument d = inv.getArgument(0);
            d.setId("c1");
            return d;
        });

        ResponseEntity<?> response = controller.create(new CreateCaptureCommandRequest("u1", null, "manager"));

        ArgumentCaptor<CaptureCommandDocument> saved = ArgumentCaptor.forClass(CaptureCommandDocument.class);
        verify(commandRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(CommandStatus.PENDING);
        assertThat(saved.getValue().getType()).isEqualTo(CaptureType.REMOTE);
        assertThat(saved.getValue().getRequestedAt()).isEqualTo(NOW);
        assertThat(((CaptureCommandDto) response.getBody()).id()).isEqualTo("c1");
    }

    @Test
    void createWithoutUserIsRejected() {
        ResponseEntity<?> response = controller.create(new CreateCaptureCommandRequest(null, CaptureType.MANUAL, "m"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        verifyNoInteractions(commandRepository);
    }

    @Test
    void listFiltersByStatusWhenGiven() {
        when(commandRepository.findByUserIdAndStatusOrderByRequestedAtAsc("u1", CommandStatus.PENDING))
                .thenReturn(List.of(new CaptureCommandDocument()));

        assertThat(controller.list("u1", CommandStatus.PENDING)).hasSize(1);
        verify(commandRepository, never()).findByUserIdOrderByRequestedAtDesc(any());
    }
}
