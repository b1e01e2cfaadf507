package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every candidate of the CandidateCollection is referenced by exactly one contest, either
 * through a CandidateSelection or as the candidate of a retention contest.
 */
public class CandidatesReferencedOnce extends AbstractRule implements TreeRule {

    public CandidatesReferencedOnce(RuleContext context) {
        super(context, Severity.ERROR);
    }

    /**
     * Candidate id to the ids of the contests referencing it, both in document order.
     * Built on every call.
     */
    public Map<String, List<String>> candidateRegistry() {
        Map<String, List<String>> registry = new LinkedHashMap<>();
        for (ElectionElement candidate : members("CandidateCollection", "Candidate")) {
            String id = candidate.objectId();
            if (id != null && !id.isBlank()) {
                registry.put(id.trim(), new ArrayList<>());
            }
        }
        for (ElectionElement contest : all("Contest")) {
            String contestId = contest.objectId();
            if (contestId == null || contestId.isBlank()) {
                continue;
            }
            List<String> candidateIds = new ArrayList<>();
            for (ElectionElement selection : contest.iter("CandidateSelection")) {
                candidateIds.addAll(splitIds(selection.childText("CandidateIds")));
            }
            candidateIds.addAll(splitIds(contest.childText("CandidateId")));
            for (String candidateId : candidateIds) {
                List<String> contests = registry.computeIfAbsent(candidateId, k -> new ArrayList<>());
                if (!contests.contains(contestId)) {
                    contests.add(contestId);
                }
            }
        }
        return registry;
    }

    @Override
    public void check(IssueCollector issues) {
        List<IssueDetail> details = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : candidateRegistry().entrySet()) {
            List<String> contests = entry.getValue();
            if (contests.isEmpty()) {
                details.add(IssueDetail.of("Candidate " + entry.getKey() + " is not referenced by any contest"));
            } else if (contests.size() > 1) {
                details.add(IssueDetail.of("Candidate " + entry.getKey()
                        + " is referenced by the following contests: " + String.join(", ", contests)));
            }
        }
        if (!details.isEmpty()) {
            issues.report("The Election File contains invalid Candidate references", details);
        }
    }
}
