package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request from a provider-hosted MCP server to approve a remote tool call
 * before the server runs it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class McpApprovalRequest implements ProtocolItem {

    public static final String TYPE = "mcp_approval_request";

    private String id;
    @JsonAlias("server_label")
    private String serverLabel;
    private String name;
    private String arguments;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String itemId() {
        return id;
    }

    /**
     * The request id doubles as the call id for approval bookkeeping.
     */
    @Override
    public String callId() {
        return id;
    }
}
