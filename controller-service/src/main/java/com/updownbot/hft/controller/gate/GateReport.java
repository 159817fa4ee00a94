package com.updownbot.hft.controller.gate;

import java.util.List;
import java.util.Optional;

public record GateReport(List<GateResult> results, boolean allPass, double timeRemainingSeconds) {

    public GateReport {
        results = List.copyOf(results);
    }

    public Optional<GateResult> firstFailing() {
        return results.stream().filter(r -> !r.pass()).findFirst();
    }

    public boolean passed(GateName name) {
        return results.stream().filter(r -> r.name() == name).findFirst().map(GateResult::pass).orElse(false);
    }
}
