package com.pdfstorage.provision;

public record ProvisionResult(Status status, String ownerLogin) {

    public enum Status { EXISTING, CREATED }

    public boolean created() {
        return status == Status.CREATED;
    }
}
