package com.openforge.physiomate.config;

import com.openforge.physiomate.agent.tool.ToolRegistry;
import com.openforge.physiomate.knowledge.EmbeddingProperties;
import com.openforge.physiomate.knowledge.MilvusProperties;
import com.openforge.physiomate.llm.LlmProperties;
import com.openforge.physiomate.patient.PatientDataProperties;
import com.openforge.physiomate.research.ResearchProperties;
import com.openforge.physiomate.workout.WorkoutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary once the context is ready.
 *
 *   - Server: port, Java version
 *   - Agent loop: turn budget, ceilings, tool pool, registered tools
 *   - LLM providers: primary + fallback (API keys masked)
 *   - Knowledge: Milvus address and collection, embedding model
 *   - Patient data: Convex deployment
 *   - Workouts: plan sampling, exercise images
 */
@Slf4j
@Component
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties         llmProperties;
    private final AgentLoopProperties   loopProperties;
    private final ResearchProperties    researchProperties;
    private final EmbeddingProperties   embeddingProperties;
    private final MilvusProperties      milvusProperties;
    private final PatientDataProperties patientProperties;
    private final WorkoutProperties     workoutProperties;
    private final ToolRegistry          coordinatorTools;
    private final ToolRegistry          researchTools;
    private final Environment           env;

    public StartupInfoRunner(LlmProperties llmProperties,
                             AgentLoopProperties loopProperties,
                             ResearchProperties researchProperties,
                             EmbeddingProperties embeddingProperties,
                             MilvusProperties milvusProperties,
                             PatientDataProperties patientProperties,
                             WorkoutProperties workoutProperties,
                             @Qualifier("coordinatorToolRegistry") ToolRegistry coordinatorTools,
                             @Qualifier("researchToolRegistry") ToolRegistry researchTools,
                             Environment env) {
        this.llmProperties       = llmProperties;
        this.loopProperties      = loopProperties;
        this.researchProperties  = researchProperties;
        this.embeddingProperties = embeddingProperties;
        this.milvusProperties    = milvusProperties;
        this.patientProperties   = patientProperties;
        this.workoutProperties   = workoutProperties;
        this.coordinatorTools    = coordinatorTools;
        this.researchTools       = researchTools;
        this.env                 = env;
    }

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║             PhysioMate  -  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Agent loop                                              ║
                ║    Max turns      : {}   research steps={}
                ║    Ceilings       : args={} chars  calls={}
                ║    Tool threads   : {}
                ║    Coordinator    : {}
                ║    Research       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Knowledge base                                          ║
                ║    Milvus         : {}  {}:{}
                ║    Collection     : {}  dim={}  min-score={}
                ║    Embedding      : {}  @ {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Patient data (Convex)                                   ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Workouts                                                ║
                ║    Temperature    : {}  max-tokens={}
                ║    Images         : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                loopProperties.maxTurns(), researchProperties.maxSteps(),
                loopProperties.maxArgumentChars(), loopProperties.maxToolCalls(),
                loopProperties.toolThreads(),
                String.join(", ", coordinatorTools.names()),
                String.join(", ", researchTools.names()),

                primary.name(), primary.model(), maskKey(primary.apiKey()),
                fallback == null ? "(none)"
                        : "%s  [%s]  key=%s".formatted(fallback.name(), fallback.model(), maskKey(fallback.apiKey())),

                milvusProperties.enabled() ? "✔ enabled" : "✘ disabled",
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionName(), milvusProperties.vectorDimensions(), milvusProperties.minScore(),
                embeddingProperties.model(), embeddingProperties.baseUrl(),

                patientProperties.configured() ? "✔ " + patientProperties.convexUrl() : "✘ CONVEX_URL not set",

                workoutProperties.temperature(), workoutProperties.maxTokens(),
                workoutProperties.images().enabled()
                        ? "✔ %s  key=%s".formatted(workoutProperties.images().model(),
                                maskKey(workoutProperties.images().apiKey()))
                        : "✘ disabled"
        );
    }

    /**
     * Shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
