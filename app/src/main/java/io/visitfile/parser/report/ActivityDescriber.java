package io.visitfile.parser.report;

import io.visitfile.parser.model.Activity;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces a short description of an activity based on the script it runs.
 */
public class ActivityDescriber {

    static final String SLEW_KEYWORD = "SLEW";
    static final String GUIDE_SCRIPT = "FGSMAIN";
    static final String GUIDE_VERIFICATION_SCRIPT = "FGSVERMAIN";

    public String describe(Activity activity) {
        Objects.requireNonNull(activity, "activity");
        if (SLEW_KEYWORD.equals(activity.keyword())) {
            return describeSlew(activity);
        }
        String script = activity.scriptName();
        Optional<String> description = switch (script) {
            case GUIDE_VERIFICATION_SCRIPT -> Optional.of("Verification");
            case GUIDE_SCRIPT -> value(activity, "DETECTOR")
                    .map(detector -> "FGS" + detector.charAt(detector.length() - 1));
            case "NRCWFSCMAIN" -> describeWavefrontSensing(activity);
            case "NRCMAIN" -> describeNircam(activity);
            case "NRCWFCPMAIN" -> describeWavefrontControlPupil(activity);
            case "SCSAMMAIN" -> describeSmallAngleManeuver(activity);
            case "NRCSUBMAIN" -> value(activity, "SUBARRAY").map(subarray -> "NRCSUBMAIN   subarray=" + subarray);
            default -> Optional.of(script);
        };
        return description.orElse(script);
    }

    private String describeSlew(Activity activity) {
        return String.format(Locale.ROOT, "Slew for %s on GS at (%s, %s) with PA=%s",
                value(activity, "GUIDEMODE").orElse("N/A"),
                value(activity, "GSRA").orElse("?"),
                value(activity, "GSDEC").orElse("?"),
                value(activity, "GSPA").orElse("?"));
    }

    private Optional<String> describeWavefrontSensing(Activity activity) {
        return readout(activity).flatMap(readout -> value(activity, "CONFIG")
                .flatMap(config -> value(activity, "WFCGROUP")
                        .flatMap(group -> filters(activity)
                                .map(filters -> activity.scriptName() + "  " + config + " WFCGROUP=" + group
                                        + "  " + readout + "  " + filters))));
    }

    private Optional<String> describeNircam(Activity activity) {
        return readout(activity).flatMap(readout -> value(activity, "CONFIG")
                .flatMap(config -> filters(activity)
                        .map(filters -> activity.scriptName() + "  " + config + "  " + readout + "  " + filters)));
    }

    private Optional<String> describeWavefrontControlPupil(Activity activity) {
        Optional<String> module = value(activity, "CONFIG")
                .filter(config -> config.length() > 3)
                .map(config -> String.valueOf(config.charAt(3)));
        return module.flatMap(mod -> value(activity, "FILTSHORT" + mod)
                .flatMap(filter -> value(activity, "PUPILSHORT" + mod)
                        .flatMap(pupil -> readout(activity)
                                .map(readout -> activity.scriptName() + "  " + filter + "+" + pupil + " " + readout))));
    }

    private Optional<String> describeSmallAngleManeuver(Activity activity) {
        return value(activity, "DELTAX")
                .flatMap(dx -> value(activity, "DELTAY")
                        .flatMap(dy -> value(activity, "DELTAPA")
                                .map(dpa -> "SCSAMMAIN  dx=" + dx + ", dy=" + dy + ", dpa=" + dpa)));
    }

    private Optional<String> readout(Activity activity) {
        return whole(activity, "NGROUPS")
                .flatMap(groups -> whole(activity, "NINTS")
                        .map(ints -> "Readout=" + groups + " groups, " + ints + " ints"));
    }

    private Optional<String> filters(Activity activity) {
        return value(activity, "FILTSHORTA")
                .flatMap(shortFilter -> value(activity, "FILTLONGA")
                        .map(longFilter -> "SW=" + shortFilter + ", LW=" + longFilter));
    }

    private static Optional<String> value(Activity activity, String name) {
        return activity.parameter(name).filter(value -> !value.isEmpty());
    }

    private static Optional<String> whole(Activity activity, String name) {
        return value(activity, name).map(raw -> {
            try {
                return String.format(Locale.ROOT, "%.0f", Double.parseDouble(raw));
            } catch (NumberFormatException ex) {
                return raw;
            }
        });
    }
}
