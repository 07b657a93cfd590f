package io.healthcontroller.reconcile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.HealthCheckPolicyStatus;
import io.healthcontroller.models.OwnerReference;
import io.healthcontroller.store.ConflictException;
import io.healthcontroller.store.EtcdMetadataStore;
import io.healthcontroller.store.MetadataStore;
import io.healthcontroller.store.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PolicyPatchHelperTest {

    private final ObjectMapper objectMapper = EtcdMetadataStore.newObjectMapper();
    private MetadataStore metadataStore;
    private HealthCheckPolicy policy;

    @BeforeEach
    void setUp() {
        metadataStore = mock(MetadataStore.class);
        policy = new HealthCheckPolicy("ns", "p1", "c1");
        policy.setRevision(7);
    }

    @Test
    void testClose_NoChanges_SkipsWrite() throws Exception {
        new PolicyPatchHelper(policy, metadataStore, objectMapper).close();

        verify(metadataStore, never()).updateHealthCheck(any());
    }

    @Test
    void testClose_WritesChangedStatusOnce() throws Exception {
        when(metadataStore.updateHealthCheck(policy)).thenReturn(9L);
        PolicyPatchHelper helper = new PolicyPatchHelper(policy, metadataStore, objectMapper);

        policy.setStatus(new HealthCheckPolicyStatus(2, 1, 0));
        helper.close();
        helper.close();

        verify(metadataStore, times(1)).updateHealthCheck(policy);
        assertThat(policy.getRevision()).isEqualTo(9L);
    }

    @Test
    void testConflict_ReappliesOwnedFieldsOntoLatest() throws Exception {
        // Given
        policy.setLabels(new HashMap<>(Map.of("team", "a")));
        PolicyPatchHelper helper = new PolicyPatchHelper(policy, metadataStore, objectMapper);
        policy.getLabels().put("cluster.x-k8s.io/cluster-name", "c1");
        OwnerReference owner = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c1", "uid-c1");
        policy.getOwnerReferences().add(owner);
        policy.setStatus(new HealthCheckPolicyStatus(3, 2, 0));

        HealthCheckPolicy latest = new HealthCheckPolicy("ns", "p1", "c1");
        latest.setLabels(new HashMap<>(Map.of("team", "b", "extra", "x")));
        latest.setRevision(8);
        when(metadataStore.updateHealthCheck(any()))
            .thenThrow(new ConflictException("revision moved"))
            .thenReturn(10L);
        when(metadataStore.getHealthCheck(policy.getKey())).thenReturn(Optional.of(latest));

        // When
        helper.close();

        // Then
        ArgumentCaptor<HealthCheckPolicy> captor = ArgumentCaptor.forClass(HealthCheckPolicy.class);
        verify(metadataStore, times(2)).updateHealthCheck(captor.capture());
        HealthCheckPolicy written = captor.getAllValues().get(1);
        assertThat(written).isSameAs(latest);
        assertThat(written.getLabels())
            .containsEntry("team", "b")
            .containsEntry("extra", "x")
            .containsEntry("cluster.x-k8s.io/cluster-name", "c1");
        assertThat(written.getOwnerReferences()).containsExactly(owner);
        assertThat(written.getStatus().getExpectedMachines()).isEqualTo(3);
        assertThat(written.getStatus().getCurrentHealthy()).isEqualTo(2);
        assertThat(policy.getRevision()).isEqualTo(10L);
    }

    @Test
    void testConflict_PolicyDeleted() throws Exception {
        PolicyPatchHelper helper = new PolicyPatchHelper(policy, metadataStore, objectMapper);
        policy.setStatus(new HealthCheckPolicyStatus(1, 1, 0));
        when(metadataStore.updateHealthCheck(any())).thenThrow(new ConflictException("revision moved"));
        when(metadataStore.getHealthCheck(policy.getKey())).thenReturn(Optional.empty());

        assertThatThrownBy(helper::close).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testConflict_GivesUpAfterMaxAttempts() throws Exception {
        PolicyPatchHelper helper = new PolicyPatchHelper(policy, metadataStore, objectMapper);
        policy.setStatus(new HealthCheckPolicyStatus(1, 1, 0));
        when(metadataStore.updateHealthCheck(any())).thenThrow(new ConflictException("revision moved"));
        when(metadataStore.getHealthCheck(policy.getKey()))
            .thenAnswer(invocation -> Optional.of(new HealthCheckPolicy("ns", "p1", "c1")));

        assertThatThrownBy(helper::close)
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("after " + PolicyPatchHelper.MAX_PATCH_ATTEMPTS + " attempts");
        verify(metadataStore, times(PolicyPatchHelper.MAX_PATCH_ATTEMPTS)).updateHealthCheck(any());
    }

    @Test
    void testConflict_StoredPolicyWithNullOwnerReferences() throws Exception {
        // Given
        HealthCheckPolicy stored = objectMapper.readValue(
            "{\"namespace\":\"ns\",\"name\":\"p1\",\"owner_references\":null,\"spec\":{\"cluster_name\":\"c1\"}}",
            HealthCheckPolicy.class);
        stored.setRevision(7);
        PolicyPatchHelper helper = new PolicyPatchHelper(stored, metadataStore, objectMapper);
        OwnerReference owner = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c1", "uid-c1");
        stored.getOwnerReferences().add(owner);
        stored.setStatus(new HealthCheckPolicyStatus(1, 1, 0));

        HealthCheckPolicy latest = objectMapper.readValue(
            "{\"namespace\":\"ns\",\"name\":\"p1\",\"owner_references\":null}", HealthCheckPolicy.class);
        when(metadataStore.updateHealthCheck(any()))
            .thenThrow(new ConflictException("revision moved"))
            .thenReturn(9L);
        when(metadataStore.getHealthCheck(stored.getKey())).thenReturn(Optional.of(latest));

        // When
        helper.close();

        // Then
        ArgumentCaptor<HealthCheckPolicy> captor = ArgumentCaptor.forClass(HealthCheckPolicy.class);
        verify(metadataStore, times(2)).updateHealthCheck(captor.capture());
        assertThat(captor.getAllValues().get(1).getOwnerReferences()).containsExactly(owner);
        assertThat(captor.getAllValues().get(1).getStatus().getExpectedMachines()).isEqualTo(1);
        assertThat(stored.getRevision()).isEqualTo(9L);
    }
}
