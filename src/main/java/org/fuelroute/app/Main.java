package org.fuelroute.app;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.core.FuelRouteException;
import org.fuelroute.pipeline.FuelRouteConfig;
import org.fuelroute.pipeline.FuelRoutePipeline;
import org.fuelroute.pipeline.PipelineRequest;
import org.fuelroute.pipeline.PipelineResult;
import org.fuelroute.planner.ImpossibleRouteException;
import org.fuelroute.planner.RefuelStop;
import org.fuelroute.planner.VehicleProfile;
import org.fuelroute.radar.AutonomySegment;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;
import org.fuelroute.station.UnknownFuelTypeException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Command-line entry point.
 *
 * <pre>
 * Main &lt;track.gpx&gt; [fuel-type] [radius-m] [top-n] [segment-km] [options]
 * Main --from &lt;place&gt; --to &lt;place&gt; [fuel-type] [radius-m] [top-n] [segment-km] [options]
 *
 * options: --tank L --consumption L/100km [--initial fraction] [--range km] [--gpx-out file]
 * </pre>
 */
@Slf4j
public class Main {
    static final String CONFIG_RESOURCE = "fuelroute.properties";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    /**
     * Parsed command line.
     */
    record Arguments(
            Path trackFile,
            String origin,
            String destination,
            FuelType fuelType,
            Double radiusMeters,
            Integer topN,
            Double segmentKm,
            VehicleProfile vehicle,
            Double rangeKm,
            Path gpxOut
    ) {
        PipelineRequest toRequest() {
            return PipelineRequest.builder()
                    .trackFile(trackFile)
                    .origin(origin)
                    .destination(destination)
                    .fuelType(fuelType)
                    .bufferMeters(radiusMeters)
                    .topN(topN)
                    .segmentKm(segmentKm)
                    .vehicle(vehicle)
                    .rangeKm(rangeKm)
                    .build();
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, FuelRoutePipeline::create);
    }

    static int run(String[] args, PrintStream out, PrintStream err, Function<FuelRouteConfig, FuelRoutePipeline> pipelines) {
        Arguments arguments;
        try {
            arguments = parse(args);
        } catch (IllegalArgumentException | UnknownFuelTypeException ex) {
            err.println(ex.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }

        FuelRouteConfig config = FuelRouteConfig.fromProperties(loadProperties());
        try (FuelRoutePipeline pipeline = pipelines.apply(config)) {
            PipelineResult result = pipeline.run(arguments.toRequest());
            print(result, out);
            if (arguments.gpxOut() != null) {
                pipeline.exportGpx(result, arguments.gpxOut());
                out.println("GPX written to " + arguments.gpxOut());
            }
            return EXIT_OK;
        } catch (ImpossibleRouteException ex) {
            err.println(ex.getMessage());
            err.printf(Locale.ROOT, "Furthest reachable point: %.1f km%n", ex.furthestReachableKm());
            return EXIT_FAILED;
        } catch (FuelRouteException | UncheckedIOException ex) {
            err.println(ex.getMessage());
            return EXIT_FAILED;
        }
    }

    static Arguments parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("missing route source");
        }
        String origin = null;
        String destination = null;
        Double tank = null;
        Double consumption = null;
        double initialFraction = 1.0d;
        Double rangeKm = null;
        Path gpxOut = null;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--from" -> origin = value(args, ++i, arg);
                case "--to" -> destination = value(args, ++i, arg);
                case "--tank" -> tank = decimal(value(args, ++i, arg), arg);
                case "--consumption" -> consumption = decimal(value(args, ++i, arg), arg);
                case "--initial" -> initialFraction = decimal(value(args, ++i, arg), arg);
                case "--range" -> rangeKm = decimal(value(args, ++i, arg), arg);
                case "--gpx-out" -> gpxOut = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("unknown option " + arg);
                    }
                    positional.add(arg);
                }
            }
        }

        Path trackFile = null;
        if (origin == null && destination == null) {
            if (positional.isEmpty()) {
                throw new IllegalArgumentException("missing track file");
            }
            trackFile = Path.of(positional.remove(0));
        } else if (origin == null || destination == null) {
            throw new IllegalArgumentException("--from and --to must be given together");
        }
        if (positional.size() > 4) {
            throw new IllegalArgumentException("too many arguments: " + positional);
        }
        if ((tank == null) != (consumption == null)) {
            throw new IllegalArgumentException("--tank and --consumption must be given together");
        }

        FuelType fuelType = !positional.isEmpty() ? FuelType.fromLabel(positional.get(0)) : null;
        Double radius = positional.size() > 1 ? decimal(positional.get(1), "radius-m") : null;
        Integer topN = positional.size() > 2 ? integer(positional.get(2), "top-n") : null;
        Double segmentKm = positional.size() > 3 ? decimal(positional.get(3), "segment-km") : null;
        VehicleProfile vehicle = tank == null ? null : VehicleProfile.of(tank, consumption, initialFraction);
        Arguments arguments = new Arguments(
                trackFile, origin, destination, fuelType, radius, topN, segmentKm, vehicle, rangeKm, gpxOut);
        arguments.toRequest().validate();
        return arguments;
    }

    static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                log.debug("{} not found on the classpath; using defaults", CONFIG_RESOURCE);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("cannot read " + CONFIG_RESOURCE, ex);
        }
        return properties;
    }

    static void print(PipelineResult result, PrintStream out) {
        out.printf(Locale.ROOT, "Route: %.1f km, %d stations in corridor%n",
                result.routeLengthKm(), result.corridorCount());
        result.bestPrice().ifPresent(price -> out.printf(Locale.ROOT,
                "Prices for %s: best %.3f, highest %.3f EUR/L%n",
                result.fuelType(), price, result.maxCorridorPrice().orElse(price)));

        if (result.plan().isPresent()) {
            out.printf(Locale.ROOT, "Refuel plan (%s): %.2f EUR for %.1f L%n",
                    result.plan().get().strategy(), result.plan().get().totalCost(), result.plan().get().totalLiters());
            for (RefuelStop stop : result.plan().get().stops()) {
                out.printf(Locale.ROOT, "  km %7.1f  %-32s %6.1f L @ %.3f = %.2f EUR%n",
                        stop.station().distanceAlongKm(), stop.station().name(),
                        stop.litersPurchased(), stop.pricePerLiter(), stop.cost());
            }
        } else {
            out.println("Selected stations:");
            for (CandidateStation station : result.selected()) {
                out.printf(Locale.ROOT, "  km %7.1f  %-32s %.3f EUR/L%s%n",
                        station.distanceAlongKm(), station.name(),
                        station.price(result.fuelType()).orElse(Double.NaN), detour(station));
            }
        }

        out.println("Autonomy radar:");
        for (AutonomySegment segment : result.radar().segments()) {
            out.printf(Locale.ROOT, "  %s -> %s: %.1f km [%s]%n",
                    segment.fromLabel(), segment.toLabel(), segment.gapKm(), segment.riskLevel());
        }
        out.println("Map: " + result.mapUrl().url());
        if (result.mapUrl().truncated()) {
            out.printf("  (%d stops omitted by the waypoint limit)%n", result.mapUrl().omittedStops());
        }
    }

    private static String detour(CandidateStation station) {
        if (station.hasRoadDetour()) {
            return String.format(Locale.ROOT, "  detour %.1f km", station.detourDistanceMeters().getAsDouble() / 1000.0d);
        }
        return station.detourDistanceOrEstimateMeters().isPresent()
                ? String.format(Locale.ROOT, "  detour ~%.1f km",
                station.detourDistanceOrEstimateMeters().getAsDouble() / 1000.0d)
                : "";
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static double decimal(String value, String name) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number, got " + value, ex);
        }
    }

    private static int integer(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer, got " + value, ex);
        }
    }

    private static String usage() {
        return "usage: Main <track.gpx> [fuel-type] [radius-m] [top-n] [segment-km] [options]\n"
                + "       Main --from <place> --to <place> [fuel-type] [radius-m] [top-n] [segment-km] [options]\n"
                + "options: --tank L --consumption L/100km [--initial fraction] [--range km] [--gpx-out file]";
    }
}
