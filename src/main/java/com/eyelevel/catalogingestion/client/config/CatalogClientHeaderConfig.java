package com.eyelevel.catalogingestion.client.config;

import com.eyelevel.catalogingestion.common.apiclient.model.HeaderConfig;

import java.util.List;

/**
 * Headers the review client sends on every call.
 */
public class CatalogClientHeaderConfig extends HeaderConfig {

    public static final String WORKSPACE_HEADER = "X-Workspace-Id";

    public CatalogClientHeaderConfig(String workspaceId) {
        final Header workspace = new Header();
        workspace.setName(WORKSPACE_HEADER);
        workspace.setValue(workspaceId);
        setHeaders(List.of(workspace));
    }
}
