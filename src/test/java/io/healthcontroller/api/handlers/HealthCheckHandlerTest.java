package io.healthcontroller.api.handlers;

import io.healthcontroller.api.models.responses.ErrorResponse;
import io.healthcontroller.api.models.responses.ReconcileAcceptedResponse;
import io.healthcontroller.enums.EventType;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.PolicyEvent;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.store.MetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HealthCheckHandlerTest {

    @Mock
    private MetadataStore metadataStore;

    @Mock
    private ReconcileQueue reconcileQueue;

    @InjectMocks
    private HealthCheckHandler healthCheckHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testListHealthChecks_Success() throws Exception {
        // Given
        List<HealthCheckPolicy> policies = List.of(new HealthCheckPolicy("ns", "p1", "c1"));
        when(metadataStore.listHealthChecks("ns")).thenReturn(policies);

        // When
        ResponseEntity<Object> response = healthCheckHandler.listHealthChecks("ns");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(policies);
    }

    @Test
    void testListHealthChecks_StoreError() throws Exception {
        when(metadataStore.listHealthChecks("ns")).thenThrow(new Exception("etcd down"));

        ResponseEntity<Object> response = healthCheckHandler.listHealthChecks("ns");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getReason()).isEqualTo("etcd down");
    }

    @Test
    void testGetHealthCheck_Success() throws Exception {
        HealthCheckPolicy policy = new HealthCheckPolicy("ns", "p1", "c1");
        when(metadataStore.getHealthCheck(ObjectKey.of("ns", "p1"))).thenReturn(Optional.of(policy));

        ResponseEntity<Object> response = healthCheckHandler.getHealthCheck("ns", "p1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(policy);
    }

    @Test
    void testGetHealthCheck_NotFound() throws Exception {
        when(metadataStore.getHealthCheck(ObjectKey.of("ns", "missing"))).thenReturn(Optional.empty());

        ResponseEntity<Object> response = healthCheckHandler.getHealthCheck("ns", "missing");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("resource_not_found_exception");
        assertThat(error.getReason()).isEqualTo("HealthCheckPolicy [ns/missing] not found");
    }

    @Test
    void testGetHealthCheck_BlankName() {
        ResponseEntity<Object> response = healthCheckHandler.getHealthCheck("ns", " ");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(metadataStore);
    }

    @Test
    void testGetEvents_Success() throws Exception {
        List<PolicyEvent> events = List.of(PolicyEvent.builder().type(EventType.WARNING).reason("MachineMarkedUnhealthy").build());
        when(metadataStore.listEvents(ObjectKey.of("ns", "p1"))).thenReturn(events);

        ResponseEntity<Object> response = healthCheckHandler.getEvents("ns", "p1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(events);
    }

    @Test
    void testReconcile_QueuesKey() {
        when(reconcileQueue.length()).thenReturn(1);

        ResponseEntity<Object> response = healthCheckHandler.reconcile("ns", "p1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(reconcileQueue).add(ObjectKey.of("ns", "p1"));
        ReconcileAcceptedResponse body = (ReconcileAcceptedResponse) response.getBody();
        assertThat(body.isAcknowledged()).isTrue();
        assertThat(body.getPolicy()).isEqualTo("ns/p1");
        assertThat(body.getQueueLength()).isEqualTo(1);
    }
}
