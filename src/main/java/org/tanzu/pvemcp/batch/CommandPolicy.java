package org.tanzu.pvemcp.batch;

import org.tanzu.pvemcp.exception.InvalidRequestException;
import org.tanzu.pvemcp.exception.PolicyViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Denylist for shell commands.
 *
 * A command is refused when it contains any denied fragment (case-insensitive) or
 * removes the root directory recursively.
 */
public class CommandPolicy {

    static final List<String> DEFAULT_DENIED = List.of(
        "rm -rf /",
        "mkfs",
        "dd if=",
        ":(){:|:&};:",
        "> /dev/sda",
        "chmod -r 777 /",
        "chown -r",
        "shutdown",
        "reboot",
        "init 0",
        "init 6",
        "halt",
        "poweroff"
    );

    private static final Pattern RM_ROOT = Pattern.compile("rm\\s+(-[a-z]*\\s+)*/($|\\s)");

    private final List<String> denied;

    public CommandPolicy(List<String> additionalDenied) {
        List<String> all = new ArrayList<>(DEFAULT_DENIED);
        if (additionalDenied != null) {
            for (String fragment : additionalDenied) {
                if (fragment != null && !fragment.isBlank()) {
                    all.add(fragment.toLowerCase(Locale.ROOT));
                }
            }
        }
        this.denied = Collections.unmodifiableList(all);
    }

    public List<String> getDenied() {
        return denied;
    }

    /**
     * @throws InvalidRequestException if the command is blank
     * @throws PolicyViolationException if the command is denied
     */
    public void check(String command) {
        if (command == null || command.isBlank()) {
            throw new InvalidRequestException("Shell command is required");
        }
        String normalized = command.toLowerCase(Locale.ROOT);
        for (String fragment : denied) {
            if (normalized.contains(fragment)) {
                throw new PolicyViolationException("Command refused by policy: contains '" + fragment + "'");
            }
        }
        if (RM_ROOT.matcher(normalized).find()) {
            throw new PolicyViolationException("Command refused by policy: removes the root directory");
        }
    }
}
