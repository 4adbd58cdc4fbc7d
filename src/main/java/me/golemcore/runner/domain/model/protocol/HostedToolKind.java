package me.golemcore.runner.domain.model.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Provider-hosted tool capabilities that are not plain function calls.
 */
public enum HostedToolKind {

    SHELL("shell_call", "shell_call_output"),

    APPLY_PATCH("apply_patch_call", "apply_patch_call_output"),

    COMPUTER("computer_call", "computer_call_output"),

    LOCAL_SHELL("local_shell_call", "local_shell_call_output");

    private final String callType;
    private final String outputType;

    HostedToolKind(String callType, String outputType) {
        this.callType = callType;
        this.outputType = outputType;
    }

    public String getCallType() {
        return callType;
    }

    public String getOutputType() {
        return outputType;
    }

    public static Optional<HostedToolKind> fromCallType(String type) {
        return Arrays.stream(values())
                .filter(kind -> kind.callType.equals(type))
                .findFirst();
    }
}
