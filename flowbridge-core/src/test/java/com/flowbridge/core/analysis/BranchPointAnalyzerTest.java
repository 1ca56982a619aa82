package com.flowbridge.core.analysis;

import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.BranchProximity;
import com.flowbridge.core.model.SourceEdge;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;
import com.flowbridge.core.model.WarningKind;
import com.flowbridge.core.parser.SourceGraphParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BranchPointAnalyzer}.
 */
class BranchPointAnalyzerTest extends FlowTestBase {

    @Test
    void analyze_branchAtEntry_isNear() {
        SourceGraph graph = parseFixture("appointment-booking.json").graph();

        BranchAnalysis analysis = new BranchPointAnalyzer(1).analyze(graph);

        assertThat(analysis.branchPoints()).singleElement().satisfies(bp -> {
            assertThat(bp.nodeId()).isEqualTo("greeting");
            assertThat(bp.depth()).isZero();
            assertThat(bp.proximity()).isEqualTo(BranchProximity.NEAR);
            assertThat(bp.outgoing()).hasSize(3);
        });
        assertThat(analysis.warnings()).isEmpty();
    }

    @Test
    void analyze_depths_areFirstVisitLayers() {
        BranchAnalysis analysis = new BranchPointAnalyzer(1)
            .analyze(parseFixture("appointment-booking.json").graph());

        assertThat(analysis.depth("greeting")).hasValue(0);
        assertThat(analysis.depth("book")).hasValue(1);
        assertThat(analysis.depth("confirm")).hasValue(2);
        assertThat(analysis.depth("hangup")).hasValue(2);
    }

    @Test
    void analyze_branchBeyondRoutingDepth_isDeepAndWarned() {
        SourceGraph graph = parseFixture("deep-branch.json").graph();

        BranchAnalysis analysis = new BranchPointAnalyzer(1).analyze(graph);

        assertThat(analysis.nearBranchPoints()).isEmpty();
        assertThat(analysis.deepBranchPoints()).extracting(BranchPoint::nodeId).containsExactly("triage");
        assertThat(analysis.warnings()).singleElement().satisfies(w -> {
            assertThat(w.kind()).isEqualTo(WarningKind.UNROUTED_BRANCH);
            assertThat(w.subject()).isEqualTo("triage");
            assertThat(w.message()).contains("redundantly");
        });
    }

    @Test
    void analyze_largerRoutingDepth_routesDeeperBranch() {
        BranchAnalysis analysis = new BranchPointAnalyzer(2).analyze(parseFixture("deep-branch.json").graph());

        assertThat(analysis.nearBranchPoints()).extracting(BranchPoint::nodeId).containsExactly("triage");
        assertThat(analysis.warnings()).isEmpty();
        assertThat(analysis.maxRoutingDepth()).isEqualTo(2);
    }

    @Test
    void analyze_zeroRoutingDepth_routesOnlyEntry() {
        BranchAnalysis analysis = new BranchPointAnalyzer(0).analyze(parseFixture("appointment-booking.json").graph());

        assertThat(analysis.nearBranchPoints()).hasSize(1);
    }

    @Test
    void analyze_cycle_terminatesWithFirstVisitDepth() {
        SourceGraph graph = new SourceGraphParser().parse("""
            {"nodes": [{"id": "ask", "isStart": true}, {"id": "check"}, {"id": "done"}],
             "edges": [{"from": "ask", "to": "check"},
                       {"from": "check", "to": "ask", "condition": {"type": "ai", "prompt": "invalid"}},
                       {"from": "check", "to": "done", "condition": {"type": "ai", "prompt": "valid"}}]}
            """);

        BranchAnalysis analysis = new BranchPointAnalyzer(1).analyze(graph);

        assertThat(analysis.depth("ask")).hasValue(0);
        assertThat(analysis.depth("check")).hasValue(1);
        assertThat(analysis.nearBranchPoints()).extracting(BranchPoint::nodeId).containsExactly("check");
    }

    @Test
    void analyze_unreachableBranch_isNotClassified() {
        // x and y form a cycle with no path from the entry node
        SourceGraph graph = new SourceGraph("Island", List.of(
            SourceNode.conversation("start", ""),
            SourceNode.conversation("x", ""),
            SourceNode.conversation("y", ""),
            SourceNode.conversation("z", "")),
            List.of(
                new SourceEdge("x", "y", null),
                new SourceEdge("x", "z", null),
                new SourceEdge("y", "x", null)),
            "start", Set.of());

        BranchAnalysis analysis = new BranchPointAnalyzer(5).analyze(graph);

        assertThat(analysis.branchPoints()).isEmpty();
        assertThat(analysis.isReachable("x")).isFalse();
        assertThat(analysis.depths()).containsOnlyKeys("start");
    }

    @Test
    void constructor_negativeDepth_throwsException() {
        assertThatThrownBy(() -> new BranchPointAnalyzer(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("negative");
    }
}
