package me.golemcore.runner.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "providerData", "provider_data" }, ignoreUnknown = true)
public class McpListTools implements ProtocolItem {

    public static final String TYPE = "mcp_list_tools";

    private String id;
    @JsonAlias("server_label")
    private String serverLabel;
    private List<Map<String, Object>> tools;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String itemId() {
        return id;
    }
}
