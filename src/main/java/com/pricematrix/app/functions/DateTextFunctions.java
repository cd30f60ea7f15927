package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Serial-day dates (DATE, YEAR, MONTH, DAY, DAYS) and text helpers
 * (CONCAT, LEFT, RIGHT, LEN, UPPER, LOWER).
 */
final class DateTextFunctions {

    /** Serial day 0. */
    static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);

    /** Serial of 9999-12-31, the last date DATE produces. */
    static final double MAX_SERIAL = toSerial(LocalDate.of(9999, 12, 31));

    private DateTextFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(new FunctionDefinition("DATE", 3, 3, ErrorPolicy.PROPAGATE_ALL, DateTextFunctions::date));
        library.register(new FunctionDefinition("YEAR", 1, 1, ErrorPolicy.PROPAGATE_ALL, args -> datePart(args, LocalDate::getYear)));
        library.register(new FunctionDefinition("MONTH", 1, 1, ErrorPolicy.PROPAGATE_ALL, args -> datePart(args, LocalDate::getMonthValue)));
        library.register(new FunctionDefinition("DAY", 1, 1, ErrorPolicy.PROPAGATE_ALL, args -> datePart(args, LocalDate::getDayOfMonth)));
        library.register(new FunctionDefinition("DAYS", 2, 2, ErrorPolicy.PROPAGATE_ALL, DateTextFunctions::days));

        library.register(new FunctionDefinition("CONCAT", 1, Integer.MAX_VALUE, ErrorPolicy.PROPAGATE_ALL, DateTextFunctions::concat));
        library.register(new FunctionDefinition("LEFT", 1, 2, ErrorPolicy.PROPAGATE_ALL, args -> slice(args, true)));
        library.register(new FunctionDefinition("RIGHT", 1, 2, ErrorPolicy.PROPAGATE_ALL, args -> slice(args, false)));
        library.register(new FunctionDefinition("LEN", 1, 1, ErrorPolicy.PROPAGATE_ALL, DateTextFunctions::len));
        library.register(new FunctionDefinition("UPPER", 1, 1, ErrorPolicy.PROPAGATE_ALL,
                args -> mapText(args, s -> s.toUpperCase(Locale.ROOT))));
        library.register(new FunctionDefinition("LOWER", 1, 1, ErrorPolicy.PROPAGATE_ALL,
                args -> mapText(args, s -> s.toLowerCase(Locale.ROOT))));
    }

    static double toSerial(LocalDate date) {
        return ChronoUnit.DAYS.between(EPOCH, date);
    }

    /**
     * Month and day overflow roll into the following months/years.
     */
    private static Value date(List<FunctionArgument> args) {
        Value year = ArgumentReader.number(args.get(0));
        Value month = ArgumentReader.number(args.get(1));
        Value day = ArgumentReader.number(args.get(2));
        for (Value part : new Value[]{year, month, day}) {
            if (part.isError()) {
                return part;
            }
        }
        try {
            LocalDate date = LocalDate.of(ArgumentReader.toInt(year), 1, 1)
                    .plusMonths(ArgumentReader.toInt(month) - 1L)
                    .plusDays(ArgumentReader.toInt(day) - 1L);
            if (date.getYear() < 1 || date.getYear() > 9999) {
                return Value.error(ErrorType.NUMBER_ERROR);
            }
            return Value.number(toSerial(date));
        } catch (DateTimeException e) {
            return Value.error(ErrorType.NUMBER_ERROR);
        }
    }

    private static Value datePart(List<FunctionArgument> args, Function<LocalDate, Integer> part) {
        Value serial = ArgumentReader.number(args.get(0));
        if (serial.isError()) {
            return serial;
        }
        if (serial.getNumber() < 0 || serial.getNumber() > MAX_SERIAL) {
            return Value.error(ErrorType.NUMBER_ERROR);
        }
        LocalDate date = EPOCH.plusDays((long) Math.floor(serial.getNumber()));
        return Value.number(part.apply(date));
    }

    private static Value days(List<FunctionArgument> args) {
        Value end = ArgumentReader.number(args.get(0));
        if (end.isError()) {
            return end;
        }
        Value start = ArgumentReader.number(args.get(1));
        if (start.isError()) {
            return start;
        }
        return Value.number(Math.floor(end.getNumber()) - Math.floor(start.getNumber()));
    }

    private static Value concat(List<FunctionArgument> args) {
        StringBuilder sb = new StringBuilder();
        for (FunctionArgument arg : args) {
            for (Value value : arg.values()) {
                sb.append(Coercion.toText(value).getText());
            }
        }
        return Value.text(sb.toString());
    }

    private static Value slice(List<FunctionArgument> args, boolean fromLeft) {
        Value text = ArgumentReader.text(args.get(0));
        if (text.isError()) {
            return text;
        }
        Value count = Coercion.toNumber(ArgumentReader.optional(args, 1, Value.number(1)));
        if (count.isError()) {
            return count;
        }
        int n = ArgumentReader.toInt(count);
        if (n < 0) {
            return ArgumentReader.typeMismatch();
        }
        String s = text.getText();
        if (n >= s.length()) {
            return text;
        }
        return Value.text(fromLeft ? s.substring(0, n) : s.substring(s.length() - n));
    }

    private static Value len(List<FunctionArgument> args) {
        Value text = ArgumentReader.text(args.get(0));
        return text.isError() ? text : Value.number(text.getText().length());
    }

    private static Value mapText(List<FunctionArgument> args, Function<String, String> mapper) {
        Value text = ArgumentReader.text(args.get(0));
        return text.isError() ? text : Value.text(mapper.apply(text.getText()));
    }
}
