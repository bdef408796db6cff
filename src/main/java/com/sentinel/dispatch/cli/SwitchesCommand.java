package com.sentinel.dispatch.cli;

import com.sentinel.core.policy.KillSwitch;
import com.sentinel.core.policy.KillSwitchService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * CLI command: sentinel switches
 * <p>
 * Lists kill switches and whether each is currently engaged.
 */
@Command(name = "switches", mixinStandardHelpOptions = true, description = "List kill switches")
@Component
public class SwitchesCommand implements Runnable {

    @Option(names = "--active", description = "Only show engaged switches")
    private boolean activeOnly;

    private final KillSwitchService killSwitchService;
    private final Clock clock;

    public SwitchesCommand(KillSwitchService killSwitchService, Clock clock) {
        this.killSwitchService = killSwitchService;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Instant now = clock.instant();
        List<KillSwitch> switches = killSwitchService.list().stream()
                .filter(ks -> !activeOnly || ks.isEffective(now))
                .toList();
        if (switches.isEmpty()) {
            ConsoleOutput.info(activeOnly ? "No kill switches engaged." : "No kill switches defined.");
            return;
        }

        System.out.printf("  %-24s %-10s %-20s %-8s %s%n", "KEY", "MODE", "SCOPE", "STATE", "REASON");
        System.out.println("  " + "-".repeat(84));
        for (KillSwitch ks : switches) {
            String state = ks.isEffective(now) ? "ACTIVE" : ks.isExpired(now) ? "EXPIRED" : "off";
            System.out.printf("  %-24s %-10s %-20s %-8s %s%n",
                    ks.key(), ks.mode().name(), ConsoleOutput.truncate(ks.scope().toString(), 20), state,
                    ks.isEffective(now) ? ConsoleOutput.truncate(ks.reason(), 30) : "-");
        }
    }
}
