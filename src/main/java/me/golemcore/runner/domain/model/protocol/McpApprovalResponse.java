package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class McpApprovalResponse implements ProtocolItem {

    public static final String TYPE = "mcp_approval_response";

    private String id;
    @JsonAlias("approval_request_id")
    private String approvalRequestId;
    private boolean approve;
    private String reason;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String itemId() {
        return id;
    }
}
