package chess.curator;

import chess.curator.cli.CuratorCommands;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CuratorApplication implements ApplicationRunner, ExitCodeGenerator {

    private final CuratorCommands commands;
    private int exitCode;

    public CuratorApplication(CuratorCommands commands) {
        this.commands = commands;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CuratorApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = commands.run(args, System.out);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
