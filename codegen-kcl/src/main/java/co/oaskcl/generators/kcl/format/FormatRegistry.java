package co.oaskcl.generators.kcl.format;

import co.oaskcl.generators.kcl.predicate.KclLiterals;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of the string formats that get a validator. Formats not listed here are advisory and
 * produce no check.
 */
public final class FormatRegistry {

    public static final String REGEX = "regex";
    public static final String DATETIME = "datetime";
    public static final String NET = "net";

    static final String DATE_PATTERN = "^\\d{4}-\\d{2}-\\d{2}$";
    static final String DATE_TIME_PATTERN = "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})$";
    static final String TIME_PATTERN = "^\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})?$";
    static final String DURATION_PATTERN = "^P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)W)?(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?)?$";
    static final String EMAIL_PATTERN = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$";
    static final String IDN_EMAIL_PATTERN = "^[\\p{L}\\p{N}._%+-]+@[\\p{L}\\p{N}.-]+\\.[\\p{L}]{2,}$";
    static final String HOSTNAME_PATTERN =
        "^[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$";
    static final String IDN_HOSTNAME_PATTERN =
        "^[\\p{L}\\p{N}](?:[\\p{L}\\p{N}-]{0,61}[\\p{L}\\p{N}])?(?:\\.[\\p{L}\\p{N}](?:[\\p{L}\\p{N}-]{0,61}[\\p{L}\\p{N}])?)*$";
    static final String IPV4_PATTERN =
        "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$";
    static final String IPV6_PATTERN = "^(?:"
        + "(?:[0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}"
        + "|(?:[0-9a-fA-F]{1,4}:){1,7}:"
        + "|(?:[0-9a-fA-F]{1,4}:){1,6}:[0-9a-fA-F]{1,4}"
        + "|(?:[0-9a-fA-F]{1,4}:){1,5}(?::[0-9a-fA-F]{1,4}){1,2}"
        + "|(?:[0-9a-fA-F]{1,4}:){1,4}(?::[0-9a-fA-F]{1,4}){1,3}"
        + "|(?:[0-9a-fA-F]{1,4}:){1,3}(?::[0-9a-fA-F]{1,4}){1,4}"
        + "|(?:[0-9a-fA-F]{1,4}:){1,2}(?::[0-9a-fA-F]{1,4}){1,5}"
        + "|[0-9a-fA-F]{1,4}:(?::[0-9a-fA-F]{1,4}){1,6}"
        + "|:(?:(?::[0-9a-fA-F]{1,4}){1,7}|:)"
        + "|::(?:ffff(?::0{1,4})?:)?(?:(?:25[0-5]|(?:2[0-4]|1?[0-9])?[0-9])\\.){3}(?:25[0-5]|(?:2[0-4]|1?[0-9])?[0-9])"
        + "|(?:[0-9a-fA-F]{1,4}:){1,4}:(?:(?:25[0-5]|(?:2[0-4]|1?[0-9])?[0-9])\\.){3}(?:25[0-5]|(?:2[0-4]|1?[0-9])?[0-9])"
        + ")$";
    static final String URI_PATTERN = "^[a-zA-Z][a-zA-Z0-9+.-]*:[^\\s]*$";
    static final String URI_REFERENCE_PATTERN =
        "^(?:[a-zA-Z][a-zA-Z0-9+.-]*:)?(?://[^\\s/$.?#].[^\\s]*|[^\\s/$.?#].[^\\s]*)$";
    static final String IRI_PATTERN = "^[\\p{L}][\\p{L}\\p{N}+.-]*:[^\\s]*$";
    static final String IRI_REFERENCE_PATTERN =
        "^(?:[\\p{L}][\\p{L}\\p{N}+.-]*:)?(?://[^\\s/$.?#].[^\\s]*|[^\\s/$.?#].[^\\s]*)$";
    static final String JSON_POINTER_PATTERN = "^(?:/(?:[^~/]|~0|~1)*)*$";
    static final String RELATIVE_JSON_POINTER_PATTERN = "^(?:0|[1-9][0-9]*)(?:#|(?:/(?:[^~/]|~0|~1)*)*)$";
    static final String UUID_PATTERN = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    private static final Map<String, FormatTemplate> TEMPLATES;

    static {
        Map<String, FormatTemplate> t = new LinkedHashMap<>();
        // dates and times
        put(t, new FormatTemplate("date", "DateValidator", "Full date (RFC 3339 full-date)", DATE_PATTERN,
            match(DATE_PATTERN) + " and datetime.validate(" + FormatTemplate.VALUE + ", \"%Y-%m-%d\")",
            Set.of(REGEX, DATETIME)));
        put(t, new FormatTemplate("date-time", "DateTimeValidator", "Date and time (RFC 3339 date-time)", DATE_TIME_PATTERN,
            match(DATE_TIME_PATTERN) + " and datetime.validate(" + FormatTemplate.VALUE + "[:10], \"%Y-%m-%d\")",
            Set.of(REGEX, DATETIME)));
        put(t, regexFormat("time", "TimeValidator", "Time of day (RFC 3339 full-time)", TIME_PATTERN));
        put(t, regexFormat("duration", "DurationValidator", "ISO 8601 duration", DURATION_PATTERN));
        // mail and host names
        put(t, regexFormat("email", "EmailValidator", "Email address", EMAIL_PATTERN));
        put(t, regexFormat("idn-email", "IdnEmailValidator", "Internationalized email address", IDN_EMAIL_PATTERN));
        put(t, regexFormat("hostname", "HostnameValidator", "Internet host name", HOSTNAME_PATTERN));
        put(t, regexFormat("idn-hostname", "IdnHostnameValidator", "Internationalized host name", IDN_HOSTNAME_PATTERN));
        // addresses
        put(t, new FormatTemplate("ipv4", "IPv4Validator", "IPv4 address in dotted-quad form", IPV4_PATTERN,
            "net.is_IPv4(" + FormatTemplate.VALUE + ")", Set.of(NET)));
        put(t, regexFormat("ipv6", "IPv6Validator", "IPv6 address", IPV6_PATTERN));
        // resource identifiers
        put(t, regexFormat("uri", "URIValidator", "Absolute URI", URI_PATTERN));
        put(t, regexFormat("uri-reference", "URIReferenceValidator", "URI or relative reference", URI_REFERENCE_PATTERN));
        put(t, regexFormat("iri", "IRIValidator", "Absolute IRI", IRI_PATTERN));
        put(t, regexFormat("iri-reference", "IRIReferenceValidator", "IRI or relative reference", IRI_REFERENCE_PATTERN));
        put(t, regexFormat("json-pointer", "JSONPointerValidator", "JSON Pointer (RFC 6901)", JSON_POINTER_PATTERN));
        put(t, regexFormat("relative-json-pointer", "RelativeJSONPointerValidator", "Relative JSON Pointer",
            RELATIVE_JSON_POINTER_PATTERN));
        put(t, regexFormat("uuid", "UUIDValidator", "UUID (RFC 4122)", UUID_PATTERN));
        put(t, new FormatTemplate("regex", "RegexValidator", "Regular expression", null,
            "regex.compile(" + FormatTemplate.VALUE + ")", Set.of(REGEX)));
        TEMPLATES = Collections.unmodifiableMap(t);
    }

    private FormatRegistry() {
    }

    /** The template for {@code format}, or empty for formats without a validator. */
    public static Optional<FormatTemplate> lookup(String format) {
        return format == null ? Optional.empty() : Optional.ofNullable(TEMPLATES.get(format));
    }

    /** Every supported format, in catalog order. */
    public static Set<String> formats() {
        return TEMPLATES.keySet();
    }

    private static void put(Map<String, FormatTemplate> t, FormatTemplate template) {
        t.put(template.format(), template);
    }

    private static FormatTemplate regexFormat(String format, String schemaName, String description, String pattern) {
        return new FormatTemplate(format, schemaName, description, pattern, match(pattern), Set.of(REGEX));
    }

    private static String match(String pattern) {
        return "regex.match(" + FormatTemplate.VALUE + ", " + KclLiterals.string(pattern) + ")";
    }

}
