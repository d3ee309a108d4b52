package com.ai.tpr.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum NavigationCommand {
    BACK(List.of("back", "go back", "previous", "undo")),
    STATUS(List.of("status", "where am i", "progress")),
    EXIT(List.of("exit", "quit", "stop", "cancel", "end"));

    private final List<String> aliases;

    NavigationCommand(List<String> aliases) {
        this.aliases = aliases;
    }

    public static Optional<NavigationCommand> fromValue(String value) {
        if (StringUtils.isBlank(value)) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (NavigationCommand command : values()) {
            if (command.name().equalsIgnoreCase(v) || command.aliases.contains(v)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
