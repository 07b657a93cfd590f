package io.healthcontroller.util;

import io.healthcontroller.models.OwnerReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Helpers for owner reference lists.
 */
public final class OwnerReferences {

    private OwnerReferences() {
        // Utility class - prevent instantiation
    }

    /**
     * Set {@code ref} in {@code refs}, replacing an existing reference to the same
     * API group, kind and name. Versions within a group are treated as the same owner.
     *
     * @return a new list, the input is not modified
     */
    public static List<OwnerReference> ensureOwnerRef(List<OwnerReference> refs, OwnerReference ref) {
        List<OwnerReference> result = refs != null ? new ArrayList<>(refs) : new ArrayList<>();
        for (int i = 0; i < result.size(); i++) {
            if (referSameObject(result.get(i), ref)) {
                result.set(i, ref);
                return result;
            }
        }
        result.add(ref);
        return result;
    }

    public static boolean referSameObject(OwnerReference a, OwnerReference b) {
        return Objects.equals(group(a.getApiVersion()), group(b.getApiVersion()))
            && Objects.equals(a.getKind(), b.getKind())
            && Objects.equals(a.getName(), b.getName());
    }

    static String group(String apiVersion) {
        if (apiVersion == null) {
            return "";
        }
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }
}
