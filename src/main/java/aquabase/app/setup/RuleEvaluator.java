package aquabase.app.setup;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.device.Account;
import aquabase.app.device.DeviceState;
import aquabase.app.device.Space;
import aquabase.app.provider.AccountRepository;
import aquabase.app.provider.Metrics;
import io.sentry.Sentry;

/**
 * Matches a freshly received device value against the active setups of its
 * space and runs the actions of every setup whose condition holds.
 * <p>
 * Setups are checked in insertion order and have no priority; when two of them
 * drive the same switch the one that runs last wins.
 */
public class RuleEvaluator {

    private static Logger log = null;

    private final AccountRepository accounts;
    private final ActionExecutor executor;
    private final Clock clock;
    private final Metrics metrics;

    public RuleEvaluator(AccountRepository accounts, ActionExecutor executor, Clock clock) {
        if (log == null) {
            log = LoggerFactory.getLogger(RuleEvaluator.class);
        }
        this.accounts = accounts;
        this.executor = executor;
        this.clock = clock;
        this.metrics = Metrics.getInstance();
    }

    public static boolean evaluateCondition(Condition condition, DeviceState state) {
        return condition != null && condition.isSatisfiedBy(state);
    }

    /**
     * @return one report per setup that fired, in the order they ran
     */
    public List<ExecutionReport> evaluate(String ownerId, String spaceId, DeviceState state) {
        final Optional<Account> account = accounts.findById(ownerId);
        if (account.isEmpty()) {
            log.warn("No account {} to evaluate setups for {}.", ownerId, state.deviceId());
            return List.of();
        }
        final Optional<Space> space = account.get().findSpace(spaceId);
        if (space.isEmpty()) {
            log.warn("No space {} in account {} to evaluate setups for {}.", spaceId, ownerId, state.deviceId());
            return List.of();
        }
        final List<Setup> candidates = space.get().getSetups().stream()
            .filter(Setup::isActive)
            .filter(s -> s.watches(state.deviceId()))
            .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            log.debug("No active setups watch {}.", state.deviceId());
            return List.of();
        }
        final List<ExecutionReport> reports = new ArrayList<>();
        for (Setup setup : candidates) {
            if (!evaluateCondition(setup.getCondition(), state)) {
                log.debug("Setup {} ({}) not met by {}.", setup.getName(), setup.getId(), state);
                continue;
            }
            log.info("Condition met for setup {} ({}). Executing {} actions.", setup.getName(), setup.getId(), setup.getActions().size());
            metrics.postMetric("setup_triggered", Map.of("device_type", state.deviceType().wireName()));
            try {
                reports.add(executor.execute(ownerId, spaceId, setup));
            } catch (RuntimeException e) {
                log.error("Setup {} ({}) failed to execute.", setup.getName(), setup.getId(), e);
                metrics.postError(RuleEvaluator.class, e);
                Sentry.captureException(e);
            }
        }
        if (!reports.isEmpty()) {
            stampTriggered(ownerId, spaceId, reports);
        }
        return reports;
    }

    /**
     * The executor saved its own changes, so the account is read again before the
     * trigger times go in.
     */
    private void stampTriggered(String ownerId, String spaceId, List<ExecutionReport> reports) {
        final Optional<Account> fresh = accounts.findById(ownerId);
        if (fresh.isEmpty()) {
            return;
        }
        final Optional<Space> space = fresh.get().findSpace(spaceId);
        if (space.isEmpty()) {
            return;
        }
        final Instant now = clock.instant();
        reports.forEach(report -> space.get().findSetup(report.setupId()).ifPresent(s -> s.setLastTriggered(now)));
        accounts.save(fresh.get());
    }
}
