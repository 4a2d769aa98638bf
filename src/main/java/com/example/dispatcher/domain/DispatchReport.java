package com.example.dispatcher.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Getter
@ToString
public class DispatchReport {

    private final boolean dump;
    private final List<JobOutcome> outcomes = new ArrayList<>();

    @Setter
    private int unlocked;

    public DispatchReport(boolean dump) {
        this.dump = dump;
    }

    public void add(JobOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<JobOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public boolean isNothingToDo() {
        return outcomes.isEmpty();
    }

    public Optional<JobOutcome> outcomeOf(Long jobId) {
        return outcomes.stream().filter(o -> o.getJobId().equals(jobId)).findFirst();
    }
}
