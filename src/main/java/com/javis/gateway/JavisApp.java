package com.javis.gateway;

import com.javis.channels.CliAdapter;
import com.javis.observability.DoctorCommand;
import com.javis.shared.config.ConfigLoader;
import com.javis.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class JavisApp {

    private static final Logger log = LoggerFactory.getLogger(JavisApp.class);

    public static void main(String[] args) throws InterruptedException {
        var config = ConfigLoader.load();
        var context = JavisContext.create(config);
        var doctor = new DoctorCommand(config.memory(), context.agents());
        var processor = new CommandProcessor(context, doctor);

        var stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var cli = new CliAdapter(stdin, System.out);
        cli.onStop(context::close);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            cli.stop();
            context.close();
        }, "javis-shutdown"));
        cli.start(msg -> cli.send(new OutboundMessage(msg.channelId(), processor.handle(msg.text()))));
        log.info("Javis started with {} agent(s) and {} workflow(s)",
                context.agents().size(), context.workflows().all().size());
        cli.awaitStop();
    }
}
