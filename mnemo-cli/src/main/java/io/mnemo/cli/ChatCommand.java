package io.mnemo.cli;

import io.mnemo.core.MnemoRuntime;
import io.mnemo.core.model.TurnResult;
import io.mnemo.core.session.Session;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send one message to the assistant")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String prompt;

    @Option(names = {"-c", "--conversation"}, description = "Conversation id (default: ${DEFAULT-VALUE})", defaultValue = "cli")
    String conversationId;

    @Option(names = "--end-session", description = "Close the conversation's session after this turn")
    boolean endSession;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (MnemoRuntime runtime = context.openRuntime()) {
            TurnResult result = runtime.turnProcessor().process(conversationId, prompt);
            if (result.aborted()) {
                System.err.println("Turn aborted");
                return 1;
            }
            System.out.println(result.content());
            if (result.extraction() != null && result.extraction().rowsWritten() > 0) {
                System.out.println("(remembered " + result.extraction().rowsWritten() + " item(s))");
            }
            if (endSession) {
                Optional<Session> closed = runtime.turnProcessor().endSession(conversationId);
                closed.ifPresent(session -> System.out.println("Session " + session.id() + " closed"));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
