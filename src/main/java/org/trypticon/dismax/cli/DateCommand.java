package org.trypticon.dismax.cli;

import java.io.PrintStream;
import java.text.ParseException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.trypticon.dismax.document.DateTools;

/**
 * Command to convert between date-times and sortable date strings.
 */
class DateCommand extends Command {
    DateCommand() {
        super("date", "Converts dates to and from sortable date strings (UTC)",
                "format <yyyy-MM-ddTHH:mm:ss[.SSS]> <resolution> | parse <date string>");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.size() == 3 && args.get(0).equals("format")) {
            return format(args.get(1), args.get(2), out, err);
        } else if (args.size() == 2 && args.get(0).equals("parse")) {
            return parse(args.get(1), out, err);
        } else {
            usage(err);
            return 1;
        }
    }

    private int format(String dateTimeString, String resolutionName, PrintStream out, PrintStream err) {
        LocalDateTime dateTime;
        try {
            dateTime = LocalDateTime.parse(dateTimeString);
        } catch (DateTimeParseException e) {
            err.println("Not a date-time: " + dateTimeString);
            return 1;
        }
        DateTools.Resolution resolution;
        try {
            resolution = DateTools.Resolution.parse(resolutionName);
        } catch (ParseException e) {
            err.println(e.getMessage());
            return 1;
        }
        long time = dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
        try {
            out.println(DateTools.timeToString(time, resolution));
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Cannot format date-time: " + dateTimeString);
            err.println(e.getMessage());
            return 1;
        }
    }

    private int parse(String dateString, PrintStream out, PrintStream err) {
        try {
            long time = DateTools.stringToTime(dateString);
            LocalDateTime dateTime = LocalDateTime.ofInstant(Instant.ofEpochMilli(time), ZoneOffset.UTC);
            out.println(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime));
            return 0;
        } catch (ParseException e) {
            err.println("Error parsing date string: " + dateString);
            printErrorSummary(err, e);
            return 1;
        }
    }
}
