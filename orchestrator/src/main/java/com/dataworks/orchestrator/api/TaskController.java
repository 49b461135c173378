package com.dataworks.orchestrator.api;

import com.dataworks.orchestrator.agent.ResultReporter;
import com.dataworks.orchestrator.agent.RunOutcome;
import com.dataworks.orchestrator.agent.RunReport;
import com.dataworks.orchestrator.api.dto.ChatHistoryResponse;
import com.dataworks.orchestrator.api.dto.RunRequest;
import com.dataworks.orchestrator.conversation.ConversationSessions;
import com.dataworks.orchestrator.conversation.ConversationStore;
import com.dataworks.orchestrator.conversation.SessionBusyException;
import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import com.dataworks.orchestrator.sandbox.SandboxViolationException;
import com.dataworks.orchestrator.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * HTTP surface.
 *
 * POST /run           run a task (query param, text/plain body or JSON body)
 * GET  /run           same, query params only
 * GET  /read          read a file inside the workspace
 * POST /clear         clear a session's conversation
 * GET  /chat_history  a session's full conversation as JSON
 */
@RestController
public class TaskController {

    static final String SESSION_HEADER = "X-Session-Id";
    static final String TASK_HEADER    = "X-Task-Id";
    static final String OUTCOME_HEADER = "X-Run-Outcome";

    private static final MediaType TEXT_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final TaskService          taskService;
    private final ResultReporter       reporter;
    private final ConversationSessions sessions;
    private final SandboxPolicy        sandbox;

    public TaskController(TaskService taskService,
                          ResultReporter reporter,
                          ConversationSessions sessions,
                          SandboxPolicy sandbox) {
        this.taskService = taskService;
        this.reporter    = reporter;
        this.sessions    = sessions;
        this.sandbox     = sandbox;
    }

    // ------------------------------------------------------------------
    // /run
    // ------------------------------------------------------------------

    /**
     * Example:
     *   curl -X POST 'http://localhost:8080/run?task=count+the+lines+in+notes.txt'
     */
    @PostMapping(value = "/run", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> runJson(@RequestBody RunRequest request,
                                          @RequestParam(required = false) String session) {
        return run(request.task(), request.session() != null ? request.session() : session);
    }

    @PostMapping("/run")
    public ResponseEntity<String> runText(@RequestParam(required = false) String task,
                                          @RequestParam(required = false) String session,
                                          @RequestBody(required = false) String body) {
        return run(task != null ? task : body, session);
    }

    @GetMapping("/run")
    public ResponseEntity<String> runGet(@RequestParam(required = false) String task,
                                         @RequestParam(required = false) String session) {
        return run(task, session);
    }

    private ResponseEntity<String> run(String task, String session) {
        if (task == null || task.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "task is required");
        }
        RunReport report;
        try {
            report = taskService.run(task.strip(), session);
        } catch (SessionBusyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        HttpStatus status = report.outcome() == RunOutcome.FATAL
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.OK;
        return ResponseEntity.status(status)
                .contentType(TEXT_UTF8)
                .header(SESSION_HEADER, report.sessionId())
                .header(TASK_HEADER, report.taskId().toString())
                .header(OUTCOME_HEADER, report.outcome().name())
                .body(reporter.format(report));
    }

    // ------------------------------------------------------------------
    // /read
    // ------------------------------------------------------------------

    /**
     * 403 when the path leaves the workspace, 404 when it is not a regular file.
     * Content that is not valid UTF-8 is returned as application/octet-stream.
     */
    @GetMapping("/read")
    public ResponseEntity<byte[]> read(@RequestParam String path) {
        Path file;
        try {
            file = sandbox.resolve(path);
        } catch (SandboxViolationException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, e.getReason());
        }
        if (!Files.isRegularFile(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + path);
        }
        try {
            byte[] content = Files.readAllBytes(file);
            return ResponseEntity.ok()
                    .contentType(isUtf8(content) ? TEXT_UTF8 : MediaType.APPLICATION_OCTET_STREAM)
                    .body(content);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Could not read " + path, e);
        }
    }

    // ------------------------------------------------------------------
    // Conversation
    // ------------------------------------------------------------------

    @PostMapping("/clear")
    public ResponseEntity<Void> clear(@RequestParam String session) {
        try {
            sessions.reset(session);
        } catch (SessionBusyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/chat_history")
    public ChatHistoryResponse chatHistory(@RequestParam String session) {
        ConversationStore store = sessions.find(session).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + session));
        return new ChatHistoryResponse(session, store.full());
    }

    private static boolean isUtf8(byte[] content) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
