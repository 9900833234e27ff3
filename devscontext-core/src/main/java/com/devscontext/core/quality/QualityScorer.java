package com.devscontext.core.quality;

import com.devscontext.core.model.FetchResult;
import com.devscontext.core.model.Gap;
import com.devscontext.core.model.GapKind;
import com.devscontext.core.model.QualityAssessment;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.TicketFields;
import com.devscontext.core.model.docs.DocsContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary presence score over six context factors.
 *
 * <p>Weights are fixed and sum to 100, so the score is always in [0, 1]. Gaps
 * are reported in factor order. The computation reads nothing but its arguments.
 */
@Component
@Slf4j
public class QualityScorer {

    static final int WEIGHT_ACCEPTANCE_CRITERIA = 25;
    static final int WEIGHT_COMPONENTS = 15;
    static final int WEIGHT_LABELS = 10;
    static final int WEIGHT_MEETINGS = 20;
    static final int WEIGHT_DOCUMENTATION = 20;
    static final int WEIGHT_LINKED_ISSUES = 10;

    public QualityAssessment score(TicketFields ticket, FetchResult contexts) {
        TicketFields fields = ticket != null ? ticket : TicketFields.EMPTY;
        List<Gap> gaps = new ArrayList<>();
        int points = 0;

        points += factor(hasText(fields.getAcceptanceCriteria()), WEIGHT_ACCEPTANCE_CRITERIA, GapKind.ACCEPTANCE_CRITERIA, gaps);
        points += factor(!fields.getComponents().isEmpty(), WEIGHT_COMPONENTS, GapKind.COMPONENTS, gaps);
        points += factor(!fields.getLabels().isEmpty(), WEIGHT_LABELS, GapKind.LABELS, gaps);
        points += factor(hasMeetings(contexts), WEIGHT_MEETINGS, GapKind.MEETINGS, gaps);
        points += factor(hasDocumentation(contexts), WEIGHT_DOCUMENTATION, GapKind.DOCUMENTATION, gaps);
        points += factor(!fields.getLinkedIssues().isEmpty(), WEIGHT_LINKED_ISSUES, GapKind.LINKED_ISSUES, gaps);

        double score = points / 100.0;
        log.debug("[QUALITY] Scored context | score={} | gaps={}", score, gaps.size());
        return new QualityAssessment(score, List.copyOf(gaps));
    }

    private static int factor(boolean present, int weight, GapKind kind, List<Gap> gaps) {
        if (present) {
            return weight;
        }
        gaps.add(Gap.of(kind));
        return 0;
    }

    private static boolean hasMeetings(FetchResult contexts) {
        if (contexts == null) {
            return false;
        }
        return contexts.getContexts().stream()
            .anyMatch(c -> c.getSourceType() == SourceType.MEETING && c.hasContent());
    }

    /**
     * Standards are always attached, so only a task-specific section counts as a
     * documentation match.
     */
    private static boolean hasDocumentation(FetchResult contexts) {
        if (contexts == null) {
            return false;
        }
        return contexts.getContexts().stream()
            .filter(c -> c.getSourceType() == SourceType.DOCUMENTATION)
            .filter(SourceContext::hasContent)
            .anyMatch(c -> c.dataAs(DocsContext.class).map(DocsContext::hasMatches).orElse(true));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
