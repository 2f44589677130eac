package org.Aayush.app;

import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.cache.SpaceTimeCache;
import org.Aayush.exogenous.io.ProviderFactory;
import org.Aayush.exogenous.key.EntityKey;
import org.Aayush.exogenous.provider.ProviderConfig;
import org.Aayush.exogenous.provider.RegionProvider;
import org.Aayush.exogenous.series.AnnualSeries;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point printing projected series for a few regions.
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage:",
            "  gdppc <model> <scenario> <growth.csv> <baseline.csv> <nightlights.csv> <region>...",
            "  pop <scenario> <projection-root> <downscaling-product> <downscaling-year> <region>...");

    /**
     * Launches the CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs the CLI against explicit output streams.
     *
     * @param args command-line arguments.
     * @param out receives {@code region,year,value} lines.
     * @param err receives usage and failure messages.
     * @return process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        RegionProvider provider;
        List<String> regions;
        try {
            switch (args[0]) {
                case "gdppc" -> {
                    if (args.length < 7) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    provider = ProviderFactory.readEconomicProvider(
                            ProviderConfig.economic(args[1], args[2]),
                            Path.of(args[3]),
                            Path.of(args[4]),
                            Path.of(args[5]));
                    regions = Arrays.asList(args).subList(6, args.length);
                }
                case "pop" -> {
                    if (args.length < 6) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    provider = ProviderFactory.readDemographicProvider(
                            ProviderConfig.demographic(args[1]),
                            Path.of(args[2]),
                            args[3],
                            Integer.parseInt(args[4]));
                    regions = Arrays.asList(args).subList(5, args.length);
                }
                default -> {
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
            }
        } catch (NumberFormatException ex) {
            err.println("downscaling year must be an integer: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (ProjectionException ex) {
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }

        for (String region : regions) {
            if (!EntityKey.hasCoarsePrefix(region)) {
                err.println("region id too short: '" + region + "'");
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }

        SpaceTimeCache cache = new SpaceTimeCache(provider);
        out.println("region,year,value");
        for (String region : regions) {
            AnnualSeries series = cache.getTimeseries(region);
            for (int i = 0; i < series.length(); i++) {
                String value = series.isMissing(i) ? "NA" : Double.toString(series.get(i));
                out.println(region + "," + (series.startYear() + i) + "," + value);
            }
        }
        return EXIT_OK;
    }
}
