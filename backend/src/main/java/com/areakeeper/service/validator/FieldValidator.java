package com.areakeeper.service.validator;

import com.areakeeper.domain.ErrorKind;
import com.areakeeper.domain.ValueKind;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks one value against a {@link ValueKind} and returns its canonical form.
 *
 * Malformed input never throws; it always comes back as a failed {@link FieldOutcome}.
 * Integers come back as {@link Integer} whatever their input type (Long, BigInteger, digit string).
 * Numbers are rounded half-up to 2 decimal places.
 */
@Singleton
public class FieldValidator {

    static final long MAX_NUMERIC = 1_000_000_000L;

    private static final BigDecimal MAX = BigDecimal.valueOf(MAX_NUMERIC);
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?(\\d+\\.?\\d*|\\.\\d+)$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?\\d{9,15}$");
    private static final Pattern PHONE_PUNCTUATION = Pattern.compile("[\\s().\\-/]");
    private static final DateTimeFormatter STRICT_DATE =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final GeometryNormalizer geometryNormalizer;

    @Inject
    public FieldValidator(GeometryNormalizer geometryNormalizer) {
        this.geometryNormalizer = geometryNormalizer;
    }

    public FieldOutcome validate(ValueKind kind, @Nullable Object raw) {
        return validate(kind, raw, null);
    }

    public FieldOutcome validate(ValueKind kind, @Nullable Object raw, @Nullable List<String> allowedValues) {
        if (raw == null) {
            return FieldOutcome.fail(ErrorKind.MISSING, "Value cannot be empty");
        }
        return switch (kind) {
            case TEXT     -> text(raw);
            case INTEGER  -> integer(raw);
            case NUMBER   -> number(raw);
            case DATE     -> date(raw);
            case URL      -> url(raw);
            case EMAIL    -> email(raw);
            case PHONE    -> phone(raw);
            case SELECT   -> select(raw, allowedValues);
            case GEOMETRY -> geometry(raw);
        };
    }

    // ── Kinds ───────────────────────────────────────────────────────────────

    private FieldOutcome text(Object raw) {
        if (!isScalar(raw)) {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "Value must be text");
        }
        String value = raw.toString().trim();
        if (value.isEmpty()) {
            return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Value cannot be empty");
        }
        return FieldOutcome.ok(value);
    }

    private FieldOutcome integer(Object raw) {
        BigInteger parsed;
        if (raw instanceof Number n) {
            BigDecimal decimal = toBigDecimal(n);
            if (decimal == null || decimal.stripTrailingZeros().scale() > 0) {
                return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "Value must be a non-negative integer");
            }
            parsed = decimal.toBigIntegerExact();
        } else if (raw instanceof String s && INTEGER.matcher(s.trim()).matches()) {
            parsed = new BigInteger(s.trim());
        } else {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "Value must be a non-negative integer");
        }
        if (parsed.signum() < 0 || parsed.compareTo(BigInteger.valueOf(MAX_NUMERIC)) > 0) {
            return FieldOutcome.fail(ErrorKind.OUT_OF_RANGE,
                "Value must be between 0 and " + MAX_NUMERIC);
        }
        return FieldOutcome.ok(parsed.intValueExact());
    }

    private FieldOutcome number(Object raw) {
        BigDecimal parsed;
        if (raw instanceof Number n) {
            parsed = toBigDecimal(n);
            if (parsed == null) {
                return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Value must be a finite number");
            }
        } else if (raw instanceof String s && DECIMAL.matcher(s.trim()).matches()) {
            parsed = new BigDecimal(s.trim().endsWith(".") ? s.trim() + "0" : s.trim());
        } else {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH,
                "Value must contain only digits and at most one decimal point");
        }
        if (parsed.signum() < 0 || parsed.compareTo(MAX) > 0) {
            return FieldOutcome.fail(ErrorKind.OUT_OF_RANGE,
                "Value must be between 0 and " + MAX_NUMERIC);
        }
        return FieldOutcome.ok(parsed.setScale(2, RoundingMode.HALF_UP));
    }

    private FieldOutcome date(Object raw) {
        if (raw instanceof LocalDate d) {
            return FieldOutcome.ok(d);
        }
        if (!(raw instanceof String s)) {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "Date must be a YYYY-MM-DD string");
        }
        String value = s.trim();
        if (!ISO_DATE.matcher(value).matches()) {
            return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Invalid date format. Please use YYYY-MM-DD");
        }
        try {
            return FieldOutcome.ok(LocalDate.parse(value, STRICT_DATE));
        } catch (DateTimeParseException e) {
            return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Not a calendar date: " + value);
        }
    }

    private FieldOutcome url(Object raw) {
        if (!(raw instanceof String s)) {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "URL must be a string");
        }
        String value = s.trim();
        try {
            URI uri = new URI(value);
            boolean hasScheme = uri.getScheme() != null && !uri.getScheme().isBlank();
            boolean hasAuthority = uri.getRawAuthority() != null && !uri.getRawAuthority().isBlank();
            if (hasScheme && hasAuthority) {
                return FieldOutcome.ok(value);
            }
        } catch (URISyntaxException e) {
            return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Invalid URL: " + e.getReason());
        }
        return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Invalid URL format");
    }

    private FieldOutcome email(Object raw) {
        if (!(raw instanceof String s)) {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "Email must be a string");
        }
        String value = s.trim();
        if (!EMAIL.matcher(value).matches()) {
            return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Invalid email format");
        }
        return FieldOutcome.ok(value);
    }

    private FieldOutcome phone(Object raw) {
        if (!isScalar(raw)) {
            return FieldOutcome.fail(ErrorKind.TYPE_MISMATCH, "Phone number must be a string");
        }
        String digits = PHONE_PUNCTUATION.matcher(raw.toString().trim()).replaceAll("");
        if (!PHONE.matcher(digits).matches()) {
            return FieldOutcome.fail(ErrorKind.FORMAT_INVALID, "Invalid phone number format");
        }
        return FieldOutcome.ok(digits);
    }

    private FieldOutcome select(Object raw, @Nullable List<String> allowedValues) {
        if (allowedValues == null || allowedValues.isEmpty()) {
            return FieldOutcome.fail(ErrorKind.NOT_ALLOWED, "No values are allowed for this field");
        }
        if (raw instanceof String s) {
            String value = s.trim();
            for (String allowed : allowedValues) {
                if (allowed.equalsIgnoreCase(value)) {
                    return FieldOutcome.ok(allowed);
                }
            }
        }
        return FieldOutcome.fail(ErrorKind.NOT_ALLOWED,
            "Invalid value. Please choose from " + String.join(", ", allowedValues));
    }

    private FieldOutcome geometry(Object raw) {
        GeometryNormalizer.Outcome outcome = geometryNormalizer.normalize(raw);
        return outcome.isValid()
            ? FieldOutcome.ok(outcome.geometry())
            : new FieldOutcome(null, outcome.error());
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private boolean isScalar(Object raw) {
        return !(raw instanceof Map<?, ?>) && !(raw instanceof Iterable<?>);
    }

    @Nullable
    private BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
