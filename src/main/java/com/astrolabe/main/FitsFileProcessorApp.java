package com.astrolabe.main;

import com.astrolabe.model.AliasTable;
import com.astrolabe.model.AppConfig;
import com.astrolabe.model.ExtractorSettings;
import com.astrolabe.model.SchemaEntry;
import com.astrolabe.service.AliasTableLoader;
import com.astrolabe.service.FieldResolutionEngine;
import com.astrolabe.service.FitsFileProcessorService;
import com.astrolabe.service.FitsHeaderService;
import com.astrolabe.service.InformationOutputter;
import com.astrolabe.service.JsonOutputter;
import com.astrolabe.service.SchemaTableLoader;
import com.astrolabe.service.SqlOutputter;
import com.astrolabe.service.TypeCoercionService;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point: extracts ObsCore metadata from the given FITS files and
 * directories and writes it to an SQL or JSON file.
 */
public class FitsFileProcessorApp {
    private static final Logger LOGGER = LoggerFactory.getLogger(FitsFileProcessorApp.class);

    static final String USAGE = "java -jar ffp.jar [-h] [-a aliases-file] [-f output-format] [-i info-file]"
            + " [-t processor-type] [-o output-dir] [-n threads] (FITS-file|FITS-directory)..";
    static final List<String> OUTPUT_FORMATS = Arrays.asList("json", "sql");
    static final List<String> PROCESSOR_TYPES = Arrays.asList("jwst");

    static final int EXIT_BAD_FORMAT = 2;
    static final int EXIT_BAD_PROCESSOR = 3;
    static final int EXIT_BAD_OUTDIR = 4;
    static final int EXIT_BAD_ALIASES = 10;
    static final int EXIT_BAD_FIELDS = 11;

    /** Signals a command line that cannot be run; carries the process exit code. */
    static class UsageException extends Exception {
        final int exitCode;

        UsageException(String message, int exitCode) {
            super(message);
            this.exitCode = exitCode;
        }
    }

    public static void main(String[] args) {
        int code = new FitsFileProcessorApp().run(args);
        if (code != 0) System.exit(code);
    }

    /** Runs the tool and returns the process exit code. */
    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println("ERROR: " + e.getMessage());
            usage(options);
            return 1;
        }
        if (cmd.hasOption("h") || cmd.getArgList().isEmpty()) {
            usage(options);
            return 0;
        }

        if (cmd.hasOption("d")) Configurator.setRootLevel(Level.DEBUG);
        else if (cmd.hasOption("v")) Configurator.setRootLevel(Level.INFO);

        ExtractorSettings settings;
        try {
            settings = toSettings(cmd);
        } catch (UsageException e) {
            System.err.println("ERROR: " + e.getMessage());
            usage(options);
            return e.exitCode;
        }

        int procCount = process(settings, cmd.getArgList());
        LOGGER.info("Processed {} FITS files.", procCount);
        System.out.println("Processed " + procCount + " FITS files.");
        return 0;
    }

    int process(ExtractorSettings settings, List<String> pathStrings) {
        Map<String, SchemaEntry> schema = new SchemaTableLoader().load(settings.fieldsFile);
        AliasTable aliases = new AliasTableLoader().load(settings.aliasFile);
        TypeCoercionService coercion = new TypeCoercionService();
        FieldResolutionEngine engine = new FieldResolutionEngine(schema, aliases);

        List<File> paths = new ArrayList<>();
        for (String p : pathStrings) paths.add(new File(p));

        try (InformationOutputter outputter = createOutputter(settings, coercion)) {
            FitsFileProcessorService processor =
                    new FitsFileProcessorService(new FitsHeaderService(settings.headerHdu), engine, outputter);
            return processor.processPaths(paths, settings.threads);
        }
    }

    static InformationOutputter createOutputter(ExtractorSettings settings, TypeCoercionService coercion) {
        if ("json".equals(settings.outputFormat)) return new JsonOutputter(settings.outputDir, coercion);
        return new SqlOutputter(settings.outputDir, settings.imageTableName, coercion);
    }

    static ExtractorSettings toSettings(CommandLine cmd) throws UsageException {
        String outputFormat = cmd.getOptionValue("f", AppConfig.getOutputFormat()).toLowerCase(Locale.ROOT);
        if (!OUTPUT_FORMATS.contains(outputFormat)) {
            throw new UsageException("Output format argument must be one of: " + String.join(", ", OUTPUT_FORMATS),
                    EXIT_BAD_FORMAT);
        }

        String type = cmd.getOptionValue("t", "jwst");
        if (!PROCESSOR_TYPES.contains(type)) {
            throw new UsageException("Processor type 'jwst' is currently the only processor type available.",
                    EXIT_BAD_PROCESSOR);
        }

        File aliasFile = readableFile(cmd.getOptionValue("a"), "aliases", EXIT_BAD_ALIASES);
        File fieldsFile = readableFile(cmd.getOptionValue("i"), "fields info", EXIT_BAD_FIELDS);

        File outputDir = new File(cmd.getOptionValue("o", AppConfig.getOutputDir()));
        if (!outputDir.isDirectory() || !outputDir.canWrite()) {
            throw new UsageException("Directory '" + outputDir + "' must exist and be writable.", EXIT_BAD_OUTDIR);
        }

        int threads = 1;
        if (cmd.hasOption("n")) {
            try {
                threads = Integer.parseInt(cmd.getOptionValue("n").trim());
            } catch (NumberFormatException e) {
                throw new UsageException("Thread count must be an integer: '" + cmd.getOptionValue("n") + "'", 1);
            }
        }

        return new ExtractorSettings(aliasFile, fieldsFile, outputFormat, outputDir,
                AppConfig.getImageTableName(), AppConfig.getHeaderHdu(), threads);
    }

    // null path means "use the bundled resource"
    private static File readableFile(String path, String what, int exitCode) throws UsageException {
        if (path == null || path.trim().isEmpty()) return null;
        File f = new File(path);
        if (!f.isFile() || !f.canRead()) {
            throw new UsageException("Unable to find and read the specified " + what + " file '" + path + "'.", exitCode);
        }
        return f;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("a").longOpt("aliases").hasArg().argName("filepath")
                .desc("File of aliases (FITS keyword to ObsCore keyword mappings) [default: bundled jwst-aliases]").build());
        options.addOption(Option.builder("d").longOpt("debug")
                .desc("Print debugging output in addition to normal processing").build());
        options.addOption(Option.builder("f").longOpt("format").hasArg().argName("output-format")
                .desc("Output format for processing results: \"json\" or \"sql\" [default: \"sql\"]").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show usage information.").build());
        options.addOption(Option.builder("i").longOpt("info").hasArg().argName("filepath")
                .desc("File listing information on fields to be processed [default: bundled jwst-fields]").build());
        options.addOption(Option.builder("n").longOpt("threads").hasArg().argName("count")
                .desc("Number of files processed in parallel [default: 1]").build());
        options.addOption(Option.builder("o").longOpt("outdir").hasArg().argName("outdir")
                .desc("Writeable directory in which to write the generated output file [default: \"out\"]").build());
        options.addOption(Option.builder("t").longOpt("type").hasArg().argName("processor-type")
                .desc("Which processor type to use [default: \"jwst\"]").build());
        options.addOption(Option.builder("v").longOpt("verbose").desc("Run in verbose mode.").build());
        return options;
    }

    private static void usage(Options options) {
        HelpFormatter fmt = new HelpFormatter();
        fmt.setWidth(100);
        fmt.printHelp(USAGE, options);
    }
}
