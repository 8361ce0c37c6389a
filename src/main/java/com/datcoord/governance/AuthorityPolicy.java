package com.datcoord.governance;

import com.datcoord.core.Identity;
import com.datcoord.versioning.ModelVersion;

public interface AuthorityPolicy {
    boolean mayFinalize(ModelVersion version, Identity caller);

    boolean isAdmin(Identity caller);
}
