package com.mimecast.wren.main;

import com.mimecast.wren.Main;
import com.mimecast.wren.config.WorkerConfig;
import com.mimecast.wren.mime.MessageTooLargeException;
import com.mimecast.wren.queue.InboundEnqueuer;
import com.mimecast.wren.queue.QueueClient;
import com.mimecast.wren.queue.QueueEntry;
import com.mimecast.wren.queue.QueueException;
import org.apache.commons.cli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Enqueue command line.
 *
 * <p>Pushes an eml file to the inbound queue as if accepted by the SMTP front end.
 */
public class EnqueueCLI {

    private final Main main;

    /**
     * Constructs a new EnqueueCLI instance.
     *
     * @param main Main instance.
     */
    public EnqueueCLI(Main main) {
        this.main = main;
    }

    /**
     * Runs the enqueue.
     *
     * @param cmd Parsed command line.
     * @return Exit code.
     */
    public int run(CommandLine cmd) {
        String file = cmd.getOptionValue("enqueue");
        String mail = cmd.getOptionValue("mail", "");
        String[] rcpt = cmd.getOptionValues("rcpt");

        if (rcpt == null || rcpt.length == 0) {
            main.log("At least one --rcpt is required");
            return 2;
        }

        List<String> recipients = Arrays.asList(rcpt);
        try {
            WorkerConfig config = Service.loadConfig(cmd.getOptionValue("conf", Main.DEFAULT_CONF), System.getenv());
            byte[] raw = Files.readAllBytes(Paths.get(file));

            try (QueueClient client = new QueueClient(config.getQueue().getUrl())) {
                QueueEntry entry = new InboundEnqueuer(client, config.getQueue()).enqueue(raw, mail, recipients);
                main.log("Enqueued " + entry.getMessageId() + " to " + config.getQueue().getName());
            }
            return 0;
        } catch (MessageTooLargeException e) {
            main.log("Message rejected: " + e.getMessage());
            return 1;
        } catch (QueueException e) {
            main.log("Queue error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            main.log("Unable to read: " + e.getMessage());
            return 1;
        }
    }
}
