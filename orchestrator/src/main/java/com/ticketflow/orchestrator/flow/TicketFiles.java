package com.ticketflow.orchestrator.flow;

/**
 * File names exchanged between the external programs, relative to the run directory.
 */
public final class TicketFiles {

    private TicketFiles() {}

    // Jitbit flow
    public static final String JITBIT_EXPORT        = "JitBit_relevante_Tickets.json";
    public static final String JITBIT_KB_EXPORT     = "JitBit_Knowledgebase.json";
    public static final String JITBIT_LLM_OUTPUT    = "Ticket_Data_Jitbit.json";
    public static final String JITBIT_NOT_RELEVANT  = "Not_Relevant_Jitbit.json";
    public static final String JITBIT_DOCX_DIR      = "documents/jitbit/";
    public static final String JITBIT_KB_DOCX       = "documents/knowledgebase/Knowledgebase.docx";

    // Jira flow
    public static final String JIRA_EXPORT          = "JIRA_relevante_Tickets.json";
    public static final String JIRA_LLM_OUTPUT      = "Ticket_Data_Jira.json";
    public static final String JIRA_NOT_RELEVANT    = "Not_Relevant_Jira.json";
    public static final String JIRA_DEDUP_OUTPUT    = "tickets_dedup_Jira.json";
    public static final String JIRA_DEDUP_GROUPS    = "duplicate_groups_Jira.json";
    public static final String JIRA_DEDUP_REVIEW    = "needs_review_Jira.csv";
    public static final String JIRA_DOCX_DIR        = "documents/jira/";

    // External programs, relative to the scripts directory
    public static final String SCRIPT_JITBIT_EXPORT    = "ticket_relevante_felder.py";
    public static final String SCRIPT_JITBIT_KB_EXPORT = "kb_export_json.py";
    public static final String SCRIPT_JIRA_EXPORT      = "jira_relevant_tickets.py";
    public static final String SCRIPT_LLM_PROCESS      = "process_tickets_with_llm.py";
    public static final String SCRIPT_DEDUP            = "scripts/dedupe_tickets.py";
    public static final String SCRIPT_TICKETS_TO_DOCX  = "tickets_to_docx.py";
    public static final String SCRIPT_KB_TO_DOCX       = "kb_to_docx.py";
}
