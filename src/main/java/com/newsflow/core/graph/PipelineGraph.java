package com.newsflow.core.graph;

import com.newsflow.core.config.EngineProperties;
import com.newsflow.core.config.PipelineProperties;
import com.newsflow.core.nodes.AnalyzeNode;
import com.newsflow.core.nodes.CredibilityNode;
import com.newsflow.core.nodes.DeduplicateNode;
import com.newsflow.core.nodes.HumanApprovalNode;
import com.newsflow.core.nodes.ImageGenNode;
import com.newsflow.core.nodes.LinkedinGenNode;
import com.newsflow.core.nodes.MergeResultsNode;
import com.newsflow.core.nodes.PublishNode;
import com.newsflow.core.nodes.ReviseNode;
import com.newsflow.core.nodes.ScrapeNode;
import com.newsflow.core.nodes.SummarizeNode;
import com.newsflow.core.persistence.CheckpointStore;
import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.ArticleSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.newsflow.core.graph.StateGraph.END;
import static com.newsflow.core.graph.StateGraph.START;

/**
 * Builds and holds the compiled graph that drives the news pipeline.
 * <p>
 * Topology:
 * <pre>
 *   START -> [fan-out: one scrape per active source] -> merge_results
 *         -> deduplicate -> credibility -> analyze -> summarize -> linkedin_gen -> image_gen
 *         -> human_approval -> [route]
 *            -> publish -> END
 *            -> revise -> summarize  (revision loop)
 * </pre>
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private final CompiledGraph<PipelineState> compiledGraph;

    public PipelineGraph(
            ScrapeNode scrapeNode,
            MergeResultsNode mergeNode,
            DeduplicateNode deduplicateNode,
            CredibilityNode credibilityNode,
            AnalyzeNode analyzeNode,
            SummarizeNode summarizeNode,
            LinkedinGenNode linkedinNode,
            ImageGenNode imageNode,
            HumanApprovalNode approvalNode,
            PublishNode publishNode,
            ReviseNode reviseNode,
            ArticleSourceRegistry sources,
            PipelineProperties pipelineProperties,
            EngineProperties engineProperties,
            CheckpointStore checkpointStore,
            GraphListener listener) {

        var graph = new StateGraph<>(PipelineState.SCHEMA, PipelineState::new)
                .addNode("scrape", scrapeNode::apply, pipelineProperties.getScraperRetry().toPolicy())
                .addNode("merge_results", mergeNode::apply)
                .addNode("deduplicate", deduplicateNode::apply)
                .addNode("credibility", credibilityNode::apply)
                .addNode("analyze", analyzeNode::apply)
                .addNode("summarize", summarizeNode::apply)
                .addNode("linkedin_gen", linkedinNode::apply)
                .addNode("image_gen", imageNode::apply)
                .addNode("human_approval", approvalNode::apply)
                .addNode("publish", publishNode::apply)
                .addNode("revise", reviseNode::apply)
                .addFanOut(START, state -> sources.activeSources().stream()
                        .map(name -> Send.to("scrape", Map.of("sourceName", name)))
                        .toList())
                .addEdge("scrape", "merge_results")
                .addEdge("merge_results", "deduplicate")
                .addEdge("deduplicate", "credibility")
                .addEdge("credibility", "analyze")
                .addEdge("analyze", "summarize")
                .addEdge("summarize", "linkedin_gen")
                .addEdge("linkedin_gen", "image_gen")
                .addEdge("image_gen", "human_approval")
                .addConditionalEdges("human_approval",
                        HumanApprovalNode::route,
                        Map.of("publish", "publish",
                                "revise", "revise"))
                .addEdge("publish", END)
                .addEdge("revise", "summarize");

        this.compiledGraph = graph.compile(CompileConfig.builder()
                .checkpointStore(checkpointStore)
                .maxParallel(engineProperties.getMaxParallel())
                .errorField(engineProperties.getErrorField())
                .listener(listener)
                .build());

        log.info("Pipeline graph compiled ({} sources, checkpoint store: {})",
                sources.activeSources().size(), checkpointStore.getClass().getSimpleName());
    }

    public CompiledGraph<PipelineState> getCompiledGraph() {
        return compiledGraph;
    }
}
