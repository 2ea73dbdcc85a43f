package org.janelia.seaflow.app;

import java.io.IOException;
import java.io.PrintStream;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.janelia.seaflow.batch.BatchSummary;
import org.janelia.seaflow.config.ApplicationConfig;
import org.janelia.seaflow.config.ApplicationConfigProvider;
import org.janelia.seaflow.evt.EvtCodec;
import org.janelia.seaflow.evt.EvtFileValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the bootstrap application for the SeaFlow EVT tools.
 */
public class SeaflowApp {

    private static final Logger LOG = LoggerFactory.getLogger(SeaflowApp.class);

    static final String FILTER_COMMAND = "filter";
    static final String VALIDATE_COMMAND = "validate";

    static final int SUCCESS = 0;
    static final int FAILURE = 1;
    static final int USAGE_ERROR = 2;

    public static void main(String[] args) {
        int status;
        try {
            status = new SeaflowApp().run(args, System.out);
        } catch (Throwable e) {
            LOG.error("Error running {}", String.join(" ", args), e);
            status = FAILURE;
        }
        if (status != SUCCESS) {
            System.exit(status);
        }
    }

    int run(String[] args, PrintStream out) throws IOException {
        AppArgs appArgs = new AppArgs();
        FilterEvtArgs filterArgs = new FilterEvtArgs();
        ValidateEvtArgs validateArgs = new ValidateEvtArgs();
        JCommander cmdline = JCommander.newBuilder()
                .programName("seaflow")
                .addObject(appArgs)
                .addCommand(FILTER_COMMAND, filterArgs)
                .addCommand(VALIDATE_COMMAND, validateArgs)
                .build();
        try {
            cmdline.parse(args);
        } catch (ParameterException e) {
            out.println(e.getMessage());
            displayAppUsage(cmdline, out);
            return USAGE_ERROR;
        }
        if (appArgs.displayUsage || cmdline.getParsedCommand() == null) {
            displayAppUsage(cmdline, out);
            return appArgs.displayUsage ? SUCCESS : USAGE_ERROR;
        }
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromDefaultResources()
                .fromFile(appArgs.configFile)
                .fromProperties(System.getProperties())
                .fromMap(appArgs.appDynamicConfig)
                .build();
        EvtFileLister evtFileLister = new EvtFileLister();
        switch (cmdline.getParsedCommand()) {
            case FILTER_COMMAND:
                try {
                    BatchSummary summary = new FilterEvtCommand(applicationConfig, evtFileLister).run(filterArgs);
                    LOG.debug("Filter run completed: {}", summary);
                    return SUCCESS;
                } catch (IllegalArgumentException e) {
                    out.println(e.getMessage());
                    displayAppUsage(cmdline, out);
                    return USAGE_ERROR;
                }
            case VALIDATE_COMMAND:
                int failed = new ValidateEvtCommand(new EvtFileValidator(new EvtCodec()), evtFileLister, out).run(validateArgs);
                return failed == 0 ? SUCCESS : FAILURE;
            default:
                throw new IllegalStateException("Unsupported command " + cmdline.getParsedCommand());
        }
    }

    private static void displayAppUsage(JCommander cmdline, PrintStream out) {
        StringBuilder usage = new StringBuilder();
        cmdline.getUsageFormatter().usage(usage);
        out.println(usage);
    }
}
