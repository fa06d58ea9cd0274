package com.cloudname.generator.naming.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deployment settings from the service configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeployConfig {

    /**
     * Append the session timestamp to deployment names so each run can be rolled back to.
     */
    private boolean rollback;
}
