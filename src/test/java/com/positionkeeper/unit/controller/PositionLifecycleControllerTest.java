package com.positionkeeper.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.positionkeeper.api.controller.PositionLifecycleController;
import com.positionkeeper.config.ApiResponseAdvice;
import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.AuditOutcome;
import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.model.ActionAudit;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.PositionDetails;
import com.positionkeeper.exception.BusinessException;
import com.positionkeeper.exception.ErrorCode;
import com.positionkeeper.exception.GlobalExceptionHandler;
import com.positionkeeper.exception.ResourceNotFoundException;
import com.positionkeeper.mapper.PositionRequestMapper;
import com.positionkeeper.service.PositionLifecycleEngine;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the PositionLifecycleController, including the error envelope
 * produced by GlobalExceptionHandler.
 */
@ExtendWith(MockitoExtension.class)
class PositionLifecycleControllerTest {

    private static final String OPEN_BODY = """
            {
              "symbol": "BTC-PERP",
              "direction": "LONG",
              "size": 10,
              "entryPrice": 50000,
              "tp1Size": 5,
              "tp2Size": 3,
              "tp1Price": 50750,
              "tp2Price": 51500,
              "stopPrice": 49000,
              "credentialId": "cred-1",
              "market": "USDT"
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private PositionLifecycleEngine positionLifecycleEngine;

    @BeforeEach
    void setUp() {
        PositionLifecycleController controller = new PositionLifecycleController(
                positionLifecycleEngine, Mappers.getMapper(PositionRequestMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Position position() {
        return Position.builder()
                .id("P1")
                .symbol("BTC-PERP")
                .direction(Direction.LONG)
                .entryPrice(new BigDecimal("50000"))
                .tp1Size(5)
                .tp2Size(3)
                .stopOrderId("SL-1")
                .phase(PositionPhase.INITIAL)
                .remainingSize(10)
                .credentialId("cred-1")
                .market("USDT")
                .build();
    }

    @Nested
    @DisplayName("POST /api/positions")
    class OpenPosition {

        @Test
        @DisplayName("Valid request opens the position and returns 201")
        void opens() throws Exception {
            when(positionLifecycleEngine.openPosition(any())).thenReturn(position());

            mockMvc.perform(post("/api/positions").contentType(MediaType.APPLICATION_JSON).content(OPEN_BODY))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value("P1"))
                    .andExpect(jsonPath("$.data.phase").value("INITIAL"))
                    .andExpect(jsonPath("$.data.stopOrderId").value("SL-1"));

            verify(positionLifecycleEngine).openPosition(
                    argThat(request -> request.getSize() == 10
                            && request.getTp1Size() == 5
                            && request.getDirection() == Direction.LONG));
        }

        @Test
        @DisplayName("Missing fields are rejected with VALIDATION_ERROR")
        void validation() throws Exception {
            mockMvc.perform(post("/api/positions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"symbol\":\"BTC-PERP\",\"size\":0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.size").exists())
                    .andExpect(jsonPath("$.error.details.stopPrice").exists());

            verify(positionLifecycleEngine, never()).openPosition(any());
        }

        @Test
        @DisplayName("Duplicate symbol is a 409 CONFLICT")
        void conflict() throws Exception {
            when(positionLifecycleEngine.openPosition(any()))
                    .thenThrow(new BusinessException(ErrorCode.CONFLICT, "Active position already exists for BTC-PERP"));

            mockMvc.perform(post("/api/positions").contentType(MediaType.APPLICATION_JSON).content(OPEN_BODY))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("CONFLICT"));
        }
    }

    @Nested
    @DisplayName("Position operations")
    class Operations {

        @Test
        @DisplayName("GET /api/positions lists active positions")
        void listActive() throws Exception {
            when(positionLifecycleEngine.listActivePositions()).thenReturn(List.of(position()));

            mockMvc.perform(get("/api/positions"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(1))
                    .andExpect(jsonPath("$.count").value(1))
                    .andExpect(jsonPath("$.data[0].symbol").value("BTC-PERP"));
        }

        @Test
        @DisplayName("GET /api/positions/{id} returns position with its audit trail")
        void details() throws Exception {
            when(positionLifecycleEngine.getPositionDetails("P1")).thenReturn(PositionDetails.builder()
                    .position(position())
                    .fills(List.of())
                    .auditTrail(List.of(ActionAudit.builder()
                            .positionId("P1")
                            .action(AuditAction.POSITION_CREATED)
                            .outcome(AuditOutcome.SUCCESS)
                            .build()))
                    .build());

            mockMvc.perform(get("/api/positions/P1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.position.id").value("P1"))
                    .andExpect(jsonPath("$.data.auditTrail[0].action").value("POSITION_CREATED"));
        }

        @Test
        @DisplayName("Unknown position is a 404")
        void notFound() throws Exception {
            when(positionLifecycleEngine.getPositionDetails("missing"))
                    .thenThrow(ResourceNotFoundException.position("missing"));

            mockMvc.perform(get("/api/positions/missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.error.retryable").value(false))
                    .andExpect(jsonPath("$.error.positionId").value("missing"))
                    .andExpect(jsonPath("$.error.path").value("/api/positions/missing"));
        }

        @Test
        @DisplayName("Extend expiry passes the hours through")
        void extendExpiry() throws Exception {
            when(positionLifecycleEngine.extendExpiry("P1", 2)).thenReturn(true);

            mockMvc.perform(post("/api/positions/P1/extend-expiry")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"hours\":2}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.extended").value(true));
        }

        @Test
        @DisplayName("Extension above one week is rejected")
        void extendExpiryTooLong() throws Exception {
            mockMvc.perform(post("/api/positions/P1/extend-expiry")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"hours\":500}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Force close of a busy position is a retryable 409 with Retry-After")
        void forceCloseBusy() throws Exception {
            when(positionLifecycleEngine.forceClose("P1")).thenThrow(BusinessException.positionBusy("P1"));

            mockMvc.perform(post("/api/positions/P1/force-close"))
                    .andExpect(status().isConflict())
                    .andExpect(header().string("Retry-After", "1"))
                    .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                    .andExpect(jsonPath("$.error.retryable").value(true))
                    .andExpect(jsonPath("$.error.positionId").value("P1"));
        }

        @Test
        @DisplayName("Manual fill without price is accepted")
        void manualFillWithoutPrice() throws Exception {
            Position reduced = position();
            reduced.setRemainingSize(6);
            when(positionLifecycleEngine.recordManualFill(eq("P1"), eq(4), isNull()))
                    .thenReturn(reduced);

            mockMvc.perform(post("/api/positions/P1/manual-fill")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"size\":4}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.remainingSize").value(6));
        }
    }
}
