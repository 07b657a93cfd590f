package io.healthcontroller.util;

import io.healthcontroller.models.OwnerReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OwnerReferencesTest {

    @Test
    void testEnsureOwnerRef_AppendsWhenAbsent() {
        OwnerReference ref = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c1", "uid-1");

        List<OwnerReference> result = OwnerReferences.ensureOwnerRef(null, ref);

        assertThat(result).containsExactly(ref);
    }

    @Test
    void testEnsureOwnerRef_ReplacesSameGroupKindAndName() {
        OwnerReference old = new OwnerReference("cluster.x-k8s.io/v1alpha2", "Cluster", "c1", "uid-old");
        OwnerReference other = new OwnerReference("apps/v1", "Deployment", "d1", "uid-d");
        OwnerReference ref = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c1", "uid-new");

        List<OwnerReference> result = OwnerReferences.ensureOwnerRef(List.of(old, other), ref);

        assertThat(result).containsExactly(ref, other);
    }

    @Test
    void testEnsureOwnerRef_IsIdempotent() {
        OwnerReference ref = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c1", "uid-1");

        List<OwnerReference> once = OwnerReferences.ensureOwnerRef(List.of(), ref);
        List<OwnerReference> twice = OwnerReferences.ensureOwnerRef(once, ref);

        assertThat(twice).hasSize(1).isEqualTo(once);
    }

    @Test
    void testDifferentNameIsDifferentOwner() {
        OwnerReference c1 = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c1", "uid-1");
        OwnerReference c2 = new OwnerReference("cluster.x-k8s.io/v1alpha3", "Cluster", "c2", "uid-2");

        assertThat(OwnerReferences.ensureOwnerRef(List.of(c1), c2)).containsExactly(c1, c2);
        assertThat(OwnerReferences.group("v1")).isEmpty();
    }
}
