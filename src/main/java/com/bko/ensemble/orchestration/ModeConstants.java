package com.bko.ensemble.orchestration;

import java.util.List;
import java.util.Map;

public final class ModeConstants {

    private ModeConstants() {
        // Private constructor to prevent instantiation
    }

    // Positions and roles
    public static final String POSITION_PRO = "pro";
    public static final String POSITION_CON = "con";
    public static final List<String> DEBATE_POSITIONS = List.of(POSITION_PRO, POSITION_CON);

    public static final List<String> DEFAULT_COUNCIL_ROLES = List.of(
            "Technical Expert",
            "Business Analyst",
            "User Advocate",
            "Risk Assessor",
            "Innovation Specialist",
            "Quality Assurance",
            "Operations Lead",
            "Strategy Advisor"
    );

    public static final List<String> DEFAULT_AUDIENCE_LEVELS = List.of("expert", "intermediate", "beginner");

    // Round instructions sent as the trailing user turn
    public static final String DEBATE_OPENING_INSTRUCTION = "Present your opening argument.";
    public static final String DEBATE_REBUTTAL_INSTRUCTION = "Provide your rebuttal.";
    public static final String DEBATE_SUMMARY_INSTRUCTION = "Provide a balanced summary of this debate.";
    public static final String COUNCIL_OPENING_INSTRUCTION = "Present your initial perspective.";
    public static final String COUNCIL_DISCUSSION_INSTRUCTION = "Provide your response to the other perspectives.";
    public static final String COUNCIL_SYNTHESIS_INSTRUCTION = "Synthesize the council's discussion into a final recommendation.";
    public static final String COUNCIL_ROLE_INSTRUCTION = "Assign the council roles now.";
    public static final String VOTE_INSTRUCTION = "Please cast your vote now.";
    public static final String JUDGE_INSTRUCTION = "Please select the winner now.";
    public static final String CONSENSUS_INSTRUCTION = "Please provide your revised response.";
    public static final String DECOMPOSITION_INSTRUCTION = "Break this task into subtasks now.";
    public static final String WORKER_INSTRUCTION = "Complete the assigned subtask.";
    public static final String HIERARCHICAL_SYNTHESIS_INSTRUCTION = "Combine the worker results into a final answer.";

    // Fallback texts
    public static final String ROUTING_FAILED_REASONING = "Routing failed, using default model";
    public static final String DEBATE_SUMMARY_FALLBACK = "The debate covered multiple perspectives but could not be summarized. See the debate history for details.";
    public static final String COUNCIL_SYNTHESIS_FALLBACK = "The council discussed multiple perspectives but could not synthesize them. See the discussion history for details.";
    public static final String HIERARCHICAL_SYNTHESIS_FALLBACK = "The coordinator was unable to synthesize the results. Please see the individual worker results below.\n\n";
    public static final String HIERARCHICAL_NO_RESULTS = "No worker results to synthesize.";
    public static final String GENERIC_SUBTASK_PREFIX = "Analyze and respond to the following question from your perspective: ";
    public static final String SUBTASK_ID_PREFIX = "subtask-";
    public static final String VARIATION_ID_SEPARATOR = "__variation_";

    // Separators
    public static final String RESPONSE_SEPARATOR = "\n\n---\n\n";

    // Prompt Templates
    public static final String ROUTING_PROMPT = """
            You route user messages to the model best able to answer them.

            Candidate models:
            {models}

            Read the user's message and reply with the identifier of exactly one candidate, written as it appears above.
            Code questions suit models known for programming, open-ended writing suits creative models, and \
            math or logic suits models with strong reasoning. For anything general, any candidate will do.

            Reply with the identifier only.
            """;

    public static final String SYNTHESIS_PROMPT = """
            Several models answered the same question independently. Write one answer that combines their strengths.
            Keep every correct and useful point, settle disagreements in favour of the best-supported claim, \
            drop repetition, and present the result as a single coherent response.

            Answers:
            {responses}

            Reply with the combined answer only. Do not mention that it was assembled from several sources.
            """;

    public static final String CRITIQUE_PROMPT = """
            Review the answer below and give concrete feedback that would make it better.
            Point out factual errors, gaps, unclear passages and weak reasoning. Suggest specific fixes.

            Answer under review:
            {response}

            Keep the critique focused and actionable.
            """;

    public static final String REVISION_PROMPT = """
            Reviewers critiqued your earlier answer. Revise it, adopting the feedback that is valid and keeping \
            what was already right.

            Your earlier answer:
            {original_response}

            Critiques:
            {critiques}

            Reply with the revised answer only.
            """;

    public static final String VOTING_PROMPT = """
            You are judging candidate answers to a user's question and must vote for the best one.

            Question:
            {question}

            Candidates:
            {candidates}

            Weigh accuracy, completeness, clarity and usefulness. You may vote for your own answer only if it is \
            genuinely the best.
            Reply with the candidate number first (for example "2"), then one short sentence explaining the vote.
            """;

    public static final String TOURNAMENT_JUDGING_PROMPT = """
            Two answers to the same question are competing. Pick the better one.

            Question:
            {question}

            Answer A:
            {response_a}

            Answer B:
            {response_b}

            Judge accuracy, completeness, clarity and usefulness.
            Reply with the single letter A or B, followed by one short sentence of justification.
            """;

    public static final String CONSENSUS_PROMPT = """
            Several models are working toward a shared answer to this question:
            {question}

            Their current answers:
            {responses}

            Revise your own answer. Adopt points the others make well, keep your points that are well founded, \
            and move toward common ground where the evidence allows it.
            Reply with your revised answer only.
            """;

    public static final String DEBATE_OPENING_PROMPT = """
            You are arguing the "{position}" side of a structured debate on this question:
            {question}

            Give your opening argument for the {position} side. State your main claims, back them with evidence \
            or reasoning, and anticipate the strongest objection.
            """;

    public static final String DEBATE_REBUTTAL_PROMPT = """
            You are arguing the "{position}" side of a structured debate on this question:
            {question}

            Arguments from the previous round:
            {arguments}

            Answer the opposing arguments directly, point out their weaknesses, and strengthen your own case.
            """;

    public static final String DEBATE_SUMMARY_PROMPT = """
            You watched a structured debate on this question:
            {question}

            Transcript:
            {debate}

            Write a balanced summary. Give the strongest points of each side, note where they agree, and state \
            which conclusions the evidence supports best.
            """;

    public static final String COUNCIL_OPENING_PROMPT = """
            You sit on an advisory council in the role of "{role}". Approach every question from that perspective.

            Question:
            {question}

            Give your initial perspective: what matters most from your role's point of view, the risks or \
            opportunities you see, and what you recommend.
            """;

    public static final String COUNCIL_DISCUSSION_PROMPT = """
            You sit on an advisory council in the role of "{role}".

            Question:
            {question}

            Perspectives shared in the previous round:
            {perspectives}

            Respond to the other members from your role's point of view. Build on good ideas, challenge weak ones, \
            and refine your recommendation.
            """;

    public static final String COUNCIL_SYNTHESIS_PROMPT = """
            You chaired an advisory council whose members held different roles. They discussed:
            {question}

            Discussion:
            {discussion}

            Produce the council's final recommendation. Reflect each role's key insights, resolve conflicts \
            between them, and give clear, actionable guidance.
            """;

    public static final String COUNCIL_ROLE_ASSIGNMENT_PROMPT = """
            You are convening an advisory council on this question:
            {question}

            There are {count} members:
            {members}

            Give each member a distinct role that brings a useful perspective to this particular question.
            Reply with only a JSON object that maps each member name, as listed above, to its role. For example:
            {"member-one": "Security Reviewer", "member-two": "Cost Analyst"}
            """;

    public static final String HIERARCHICAL_DECOMPOSITION_PROMPT = """
            You coordinate a team of worker models. Split the task below into independent subtasks and assign \
            each one to the most suitable worker.

            Task:
            {question}

            Available workers ({count}):
            {workers}

            Each subtask must be self-contained and clearly described. Create between 2 and {count} subtasks.
            Reply with only a JSON object in this form:
            {"subtasks": [{"id": "subtask-1", "description": "what to do", "assignedModel": "worker-name"}]}
            """;

    public static final String HIERARCHICAL_WORKER_PROMPT = """
            A coordinator assigned you one part of a larger task.

            Overall task:
            {context}

            Your subtask:
            {task}

            Complete your subtask thoroughly. Stay within its scope; other workers handle the rest.
            """;

    public static final String HIERARCHICAL_SYNTHESIS_PROMPT = """
            You split a task into subtasks and delegated them. The workers have reported back.

            Original task:
            {question}

            Worker results:
            {results}

            Combine the results into one complete answer to the original task. Fill gaps and remove overlap.
            """;

    public static final String EXPLAINER_INITIAL_PROMPT = """
            Explain the topic below to a {level} audience.

            Topic:
            {question}

            Guidelines for a {level} audience:
            {level_guidelines}
            """;

    public static final String EXPLAINER_SIMPLIFY_PROMPT = """
            Adapt an existing explanation for a {level} audience.

            Topic:
            {question}

            Existing explanation:
            {previous_explanation}

            Guidelines for a {level} audience:
            {level_guidelines}

            Rewrite the explanation for this audience. Keep it accurate while changing depth, vocabulary and examples.
            """;

    public static final String CONFIDENCE_RESPONSE_PROMPT = """
            Answer the question below carefully.

            After the answer, on its own final line, rate your confidence in exactly this format:
            CONFIDENCE: <score>

            The score is a decimal from 0.0 (guessing) to 1.0 (certain). Be honest: lower it for ambiguous \
            questions, contested facts, or anything beyond what you reliably know.

            Question:
            {question}
            """;

    public static final String CONFIDENCE_SYNTHESIS_PROMPT = """
            Several models answered the same question and rated their own confidence.
            Write one answer that gives more weight to high-confidence answers, while still keeping valuable \
            points from less confident ones when they hold up.

            Answers, most confident first:
            {responses}

            Reply with the combined answer only.
            """;

    public static final String GENERIC_AUDIENCE_GUIDELINES = """
            - Match vocabulary and depth to this audience
            - Use examples the audience will recognise
            - Keep the explanation accurate""";

    public static final Map<String, String> AUDIENCE_GUIDELINES = Map.of(
            "expert", """
                    - Use precise terminology without defining it
                    - Assume deep background knowledge
                    - Cover nuances, edge cases and trade-offs
                    - Prefer density over length""",
            "intermediate", """
                    - Use standard terms and define specialised ones
                    - Assume working familiarity with the field
                    - Give context for harder concepts
                    - Include practical examples""",
            "beginner", """
                    - Use plain everyday language
                    - Define any jargon the moment it appears
                    - Lean on analogies to familiar things
                    - Build the idea step by step""",
            "child", """
                    - Use short sentences and simple words
                    - Compare ideas to games, animals or toys
                    - Break everything into tiny steps
                    - Keep it friendly and fun""",
            "non-technical", """
                    - Avoid technical jargon entirely
                    - Focus on practical impact and everyday relevance
                    - Use real-life analogies
                    - Stress the practical takeaways"""
    );
}
