package dumb.le;

import dumb.le.TemplateEntry.Element;
import dumb.le.TemplateEntry.Kind;
import dumb.le.TemplateEntry.Placeholder;
import dumb.le.TemplateEntry.Slot;
import dumb.le.TemplateEntry.Word;

import java.util.ArrayList;
import java.util.List;

/**
 * Templates every document can use without declaring them: time relations the
 * inference engine provides and the common comparison built-ins. Placeholders are
 * written {@code $i} for argument {@code i}.
 */
final class Builtins {

    static final List<TemplateEntry> META = List.of(
            meta("\\=", "$0 is different from $1", "first_thing:time", "second_thing:time"),
            meta("=", "$0 is equal to $1", "first_thing:time", "second_thing:time"));

    static final List<TemplateEntry> PLAIN = List.of(
            plain("has_as_head_before", "$0 has $1 as head before $2", "list:list", "symbol:term", "rest_of_list:list"),
            plain("append", "appending $0 then $1 gives $2", "first_list:list", "second_list:list", "third_list:list"),
            plain("reverse", "$0 is the reverse of $1", "list:list", "other_list:list"),
            plain("same_date", "$0 is the same date as $1", "time_1:time", "time_2:time"),
            plain("between", "$2 is between $0 & $1", "min:date", "max:date", "middle:date"),
            plain("is_1_day_after", "$0 is 1 day after $1", "date:date", "second_date:date"),
            plain("is_days_after", "$0 is $1 days after $2", "date:date", "number:number", "second_date:date"),
            plain("immediately_before", "$0 is immediately before $1", "time_1:time", "time_2:time"),
            plain("\\=", "$0 is different from $1", "thing_1:thing", "thing_2:thing"),
            plain("==", "$0 is equivalent to $1", "thing_1:thing", "thing_2:thing"),
            plain("is_a", "$0 is of type $1", "object:object", "type:type"),
            plain("is_not_before", "$0 is not before $1", "time1:time", "time2:time"),
            plain("=", "$0 is equal to $1", "thing_1:thing", "thing_2:thing"),
            plain("isbefore", "$0 is before $1", "time1:time", "time2:time"),
            plain("isafter", "$0 is after $1", "time1:time", "time2:time"),
            plain("member", "$0 is in $1", "member:object", "list:list"),
            plain("is", "$0 is $1", "term:term", "expression:expression"),
            plain("\\=@=", "$0 \\ = @ = $1", "thing_1:thing", "thing_2:thing"),
            plain("\\==", "$0 \\ = = $1", "thing_1:thing", "thing_2:thing"),
            plain("=\\=", "$0 = \\ = $1", "thing_1:thing", "thing_2:thing"),
            plain("=@=", "$0 = @ = $1", "thing_1:thing", "thing_2:thing"),
            plain("==", "$0 = = $1", "thing_1:thing", "thing_2:thing"),
            plain("=<", "$0 = < $1", "thing_1:thing", "thing_2:thing"),
            plain(">=", "$0 > = $1", "thing_1:thing", "thing_2:thing"),
            plain("=", "$0 = $1", "thing_1:thing", "thing_2:thing"),
            plain("<", "$0 < $1", "thing_1:thing", "thing_2:thing"),
            plain(">", "$0 > $1", "thing_1:thing", "thing_2:thing"),
            plain("unparse_time", "$0 corresponds to date $1", "secs:time", "date:date"),
            plain("must_be", "$1 must be $0", "type:type", "term:term"),
            plain("must_not_be", "$0 must not be $1", "term:term", "variable:variable"));

    private Builtins() {
    }

    private static TemplateEntry meta(String predicate, String pattern, String... slots) {
        return entry(Kind.META, predicate, pattern, slots);
    }

    private static TemplateEntry plain(String predicate, String pattern, String... slots) {
        return entry(Kind.PLAIN, predicate, pattern, slots);
    }

    private static TemplateEntry entry(Kind kind, String predicate, String pattern, String... slots) {
        var elements = new ArrayList<Element>();
        for (var w : pattern.split(" "))
            elements.add(w.startsWith("$") ? new Placeholder(Integer.parseInt(w.substring(1))) : new Word(w));
        var slotList = new ArrayList<Slot>();
        for (var s : slots) {
            var colon = s.indexOf(':');
            slotList.add(new Slot(s.substring(0, colon), s.substring(colon + 1)));
        }
        return new TemplateEntry(kind, predicate, slotList, elements);
    }
}
