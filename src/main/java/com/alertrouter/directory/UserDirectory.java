package com.alertrouter.directory;

import com.alertrouter.domain.model.Recipient;
import java.util.List;

/**
 * Source of the users holding a role. Backed by configuration here; a production deployment
 * plugs in its identity store by providing another bean of this type.
 */
public interface UserDirectory {

    /**
     * Returns the users holding the role, or an empty list for an unknown role.
     */
    List<Recipient> getUsersByRole(String role);
}
