package org.tanzu.pvemcp.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tanzu.pvemcp.exception.ErrorKind;
import org.tanzu.pvemcp.exception.InvalidRequestException;
import org.tanzu.pvemcp.exception.PolicyViolationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandPolicyTest {

    private final CommandPolicy policy = new CommandPolicy(List.of("Systemctl Stop"));

    @ParameterizedTest
    @ValueSource(strings = {"uptime", "df -h", "ls -la /var/log", "pveversion -v"})
    void ordinaryCommandsPass(String command) {
        assertThatCode(() -> policy.check(command)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"rm -rf /", "RM -RF /", "rm -r -f /", "mkfs.ext4 /dev/sdb1", "dd if=/dev/zero of=/dev/sda",
            "sleep 5; reboot", "poweroff", "systemctl stop pveproxy"})
    void destructiveCommandsAreDenied(String command) {
        assertThatThrownBy(() -> policy.check(command))
                .isInstanceOf(PolicyViolationException.class)
                .satisfies(e -> assertThat(((PolicyViolationException) e).getKind()).isEqualTo(ErrorKind.POLICY_VIOLATION));
    }

    @Test
    void blankCommandIsInvalid() {
        assertThatThrownBy(() -> policy.check("  ")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> policy.check(null)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void extraFragmentsAreLowercased() {
        assertThat(policy.getDenied()).contains("systemctl stop").containsAll(CommandPolicy.DEFAULT_DENIED);
    }
}
