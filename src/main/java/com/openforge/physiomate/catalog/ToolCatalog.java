package com.openforge.physiomate.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.agent.tool.ToolInvocation;
import com.openforge.physiomate.agent.tool.ToolRegistry;
import com.openforge.physiomate.agent.tool.ToolSpec;
import com.openforge.physiomate.knowledge.KnowledgeSearchTools;
import com.openforge.physiomate.llm.model.ToolFunction;
import com.openforge.physiomate.patient.PatientContextTool;
import com.openforge.physiomate.research.ResearchAgent;
import com.openforge.physiomate.research.ResearchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The two tool tables of the application.
 *
 *   coordinatorToolRegistry: sent to the conversational model every turn:
 *       research, get_patient_muscle_context (INTERNAL)
 *       select_muscles, update_muscle, add_knot, create_assessment (ACTION)
 *
 *   researchToolRegistry: private to the research sub-agent:
 *       the five knowledge-base searches and get_patient_muscle_context
 *
 * Schemas are JSON Schema text sent to the model verbatim.
 */
@Configuration
public class ToolCatalog {

    // ── Shared ───────────────────────────────────────────────────────────────

    static final String PATIENT_CONTEXT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "body_id":      {"type": "string", "description": "The patient's body ID."},
                "muscle_group": {"type": "string", "description": "Optional muscle group filter."},
                "mesh_id":      {"type": "string", "description": "Optional specific muscle mesh ID."}
              },
              "required": ["body_id"]
            }
            """;

    // ── Coordinator ──────────────────────────────────────────────────────────

    static final String RESEARCH_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "The clinical question to research."},
                "focus": {
                  "type": "string",
                  "description": "Optional focus area, e.g. a condition, muscle group or exercise."
                }
              },
              "required": ["query"]
            }
            """;

    static final String SELECT_MUSCLES_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "meshIds": {
                  "type": "array",
                  "items": {"type": "string"},
                  "description": "Exact mesh IDs to select. Use _1 suffix for right side."
                }
              },
              "required": ["meshIds"]
            }
            """;

    static final String UPDATE_MUSCLE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "meshId": {
                  "type": "string",
                  "description": "Exact mesh ID of the muscle. Use _1 suffix for right side."
                },
                "condition": {
                  "type": "string",
                  "enum": ["healthy", "tight", "knotted", "strained", "torn",
                           "recovering", "inflamed", "weak", "fatigued"]
                },
                "pain":     {"type": "number", "description": "Pain level 0-10"},
                "strength": {"type": "number", "description": "Strength ratio 0-1"},
                "mobility": {"type": "number", "description": "Mobility/ROM ratio 0-1"},
                "summary":  {"type": "string", "description": "Clinical summary and recommendations."}
              },
              "required": ["meshId"]
            }
            """;

    static final String ADD_KNOT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "meshId":   {"type": "string", "description": "Exact mesh ID of the muscle"},
                "severity": {"type": "number", "description": "Severity 0-1"},
                "type":     {"type": "string", "enum": ["trigger_point", "adhesion", "spasm"]}
              },
              "required": ["meshId", "severity", "type"]
            }
            """;

    static final String CREATE_ASSESSMENT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "summary": {"type": "string", "description": "Overall assessment summary"},
                "structuresAffected": {
                  "type": "array",
                  "items": {"type": "string"},
                  "description": "List of mesh IDs of affected structures"
                }
              },
              "required": ["summary", "structuresAffected"]
            }
            """;

    // ── Research ─────────────────────────────────────────────────────────────

    static final String SEARCH_KNOWLEDGE_BASE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "Natural language search query."},
                "top_k": {"type": "integer", "description": "Number of results (default 5)."}
              },
              "required": ["query"]
            }
            """;

    static final String SEARCH_BY_MUSCLE_GROUP_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "muscle_group": {"type": "string", "description": "One of the 17 muscle group names."},
                "top_k": {"type": "integer", "description": "Number of results (default 5)."}
              },
              "required": ["muscle_group"]
            }
            """;

    static final String SEARCH_BY_CONDITION_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "condition": {
                  "type": "string",
                  "description": "Condition or diagnosis (e.g., \\"ACL tear\\", \\"frozen shoulder\\")."
                },
                "top_k": {"type": "integer", "description": "Number of results (default 5)."}
              },
              "required": ["condition"]
            }
            """;

    static final String SEARCH_BY_CONTENT_TYPE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "content_type": {"type": "string", "description": "The content category to filter on."},
                "query": {"type": "string", "description": "Search query within that category."},
                "top_k": {"type": "integer", "description": "Number of results (default 5)."}
              },
              "required": ["content_type", "query"]
            }
            """;

    static final String SEARCH_BY_EXERCISE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "exercise": {
                  "type": "string",
                  "description": "Exercise name (e.g., \\"bench press\\", \\"shoulder external rotation\\")."
                },
                "top_k": {"type": "integer", "description": "Number of results (default 5)."}
              },
              "required": ["exercise"]
            }
            """;

    private final ObjectMapper objectMapper;

    public ToolCatalog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    public ToolRegistry coordinatorToolRegistry(ResearchAgent researchAgent, PatientContextTool patientContext) {
        return ToolRegistry.builder()
                .register(ToolSpec.subAgent(declare("research",
                        "Research sub-agent that autonomously searches the clinical knowledge base using "
                        + "multiple strategies (by condition, muscle group, exercise, content type and general "
                        + "search) and returns a synthesized, cited answer. Use before any clinical recommendation.",
                        RESEARCH_SCHEMA), "Researching",
                        inv -> researchAgent.research(inv.requireText("query"), inv.text("focus"), inv.substeps())))
                .register(patientContextSpec(patientContext))
                .register(ToolSpec.action(declare("select_muscles",
                        "Highlight/select specific muscles on the 3D model. Use when the user describes a body "
                        + "area without having selected muscles, or to correct a previous selection.",
                        SELECT_MUSCLES_SCHEMA), "Selecting muscles"))
                .register(ToolSpec.action(declare("update_muscle",
                        "Update a muscle's condition, pain level, strength, mobility, and/or clinical summary. "
                        + "Use when you have gathered enough information to assess a specific muscle.",
                        UPDATE_MUSCLE_SCHEMA), "Updating muscle state"))
                .register(ToolSpec.action(declare("add_knot",
                        "Add a trigger point, adhesion, or spasm to a muscle. "
                        + "Use when the user describes a specific localized point of tension or pain.",
                        ADD_KNOT_SCHEMA), "Adding trigger point"))
                .register(ToolSpec.action(declare("create_assessment",
                        "Create an overall assessment summarizing your findings from this conversation.",
                        CREATE_ASSESSMENT_SCHEMA), "Creating assessment"))
                .build();
    }

    @Bean
    public ToolRegistry researchToolRegistry(KnowledgeSearchTools search,
                                             PatientContextTool patientContext,
                                             ResearchProperties research) {
        int defaultTopK = research.topK();
        return ToolRegistry.builder()
                .register(ToolSpec.internal(declare("search_knowledge_base",
                        "Search the physical therapy knowledge base for clinical evidence. "
                        + "Use for general questions about treatments, exercises, protocols, or evidence.",
                        SEARCH_KNOWLEDGE_BASE_SCHEMA), "Searching knowledge base",
                        inv -> search.searchKnowledgeBase(inv.requireText("query"), topK(inv, defaultTopK))))
                .register(ToolSpec.internal(declare("search_by_muscle_group",
                        "Search for content related to a specific muscle group. "
                        + "Valid groups: neck, upper_back, lower_back, chest, shoulders, rotator_cuff, biceps, "
                        + "triceps, forearms, core, hip_flexors, glutes, quads, adductors, hamstrings, calves, shins.",
                        SEARCH_BY_MUSCLE_GROUP_SCHEMA), "Searching by muscle group",
                        inv -> search.searchByMuscleGroup(inv.requireText("muscle_group"), topK(inv, defaultTopK))))
                .register(ToolSpec.internal(declare("search_by_condition",
                        "Search for evidence related to a clinical condition or diagnosis. Use for "
                        + "condition-specific protocols, rehabilitation guidelines, or treatment evidence.",
                        SEARCH_BY_CONDITION_SCHEMA), "Searching by condition",
                        inv -> search.searchByCondition(inv.requireText("condition"), topK(inv, defaultTopK))))
                .register(ToolSpec.internal(declare("search_by_content_type",
                        "Search within a specific content category. Valid types: exercise_technique, "
                        + "rehab_protocol, pathology, assessment, anatomy, training_principles, reference_data.",
                        SEARCH_BY_CONTENT_TYPE_SCHEMA), "Searching by content type",
                        inv -> search.searchByContentType(inv.requireText("content_type"),
                                inv.requireText("query"), topK(inv, defaultTopK))))
                .register(ToolSpec.internal(declare("search_by_exercise",
                        "Search for information about a specific exercise.",
                        SEARCH_BY_EXERCISE_SCHEMA), "Searching exercise database",
                        inv -> search.searchByExercise(inv.requireText("exercise"), topK(inv, defaultTopK))))
                .register(patientContextSpec(patientContext))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ToolSpec patientContextSpec(PatientContextTool patientContext) {
        return ToolSpec.internal(declare("get_patient_muscle_context",
                "Get the current patient's muscle states from the database. "
                + "Use to understand the patient's musculoskeletal status before recommendations.",
                PATIENT_CONTEXT_SCHEMA), "Loading patient data",
                inv -> patientContext.describe(inv.requireText("body_id"),
                        inv.text("muscle_group"), inv.text("mesh_id")));
    }

    ToolFunction declare(String name, String description, String schema) {
        try {
            return new ToolFunction(name, description, objectMapper.readTree(schema));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid schema for tool " + name, e);
        }
    }

    private static int topK(ToolInvocation invocation, int defaultTopK) {
        int requested = invocation.intOr("top_k", defaultTopK);
        return requested > 0 ? Math.min(requested, 50) : defaultTopK;
    }
}
