package io.workgate.execution;

import java.util.List;

/**
 * Result of {@link TaskExecutionEngine#submitGroup}.
 *
 * @param members  outcomes of the independently submitted units, in submission order
 * @param callback outcome of the callback unit that ran after all members completed
 */
public record FanInResult(List<TaskOutcome> members, TaskOutcome callback) {

    public FanInResult {
        members = List.copyOf(members);
    }

    public long succeededMembers() {
        return members.stream().filter(TaskOutcome::succeeded).count();
    }
}
