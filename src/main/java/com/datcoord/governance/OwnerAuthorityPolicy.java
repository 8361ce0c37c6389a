package com.datcoord.governance;

import java.util.Objects;

import com.datcoord.core.Identity;
import com.datcoord.versioning.ModelVersion;

public class OwnerAuthorityPolicy implements AuthorityPolicy {
    private final Identity admin;

    public OwnerAuthorityPolicy(Identity admin) {
        this.admin = Objects.requireNonNull(admin, "admin");
    }

    @Override
    public boolean mayFinalize(ModelVersion version, Identity caller) {
        return caller != null && version.owner().equals(caller);
    }

    @Override
    public boolean isAdmin(Identity caller) {
        return admin.equals(caller);
    }

    public Identity admin() {
        return admin;
    }
}
