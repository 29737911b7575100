package com.example.skirmish.util;

import com.example.skirmish.combat.Combatant;

import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders viewer-relative combat messages.
 *
 * Supported tokens:
 * <ul>
 *   <li>{@code $You()} / {@code $you()} - the message source, "You"/"you" for the source itself</li>
 *   <li>{@code $You(key)} / {@code $you(key)} - the combatant mapped to {@code key}</li>
 *   <li>{@code $Your()} / {@code $your()} and {@code $Your(key)} - possessive forms</li>
 *   <li>{@code $conj(verb)} - "attack" for the source, "attacks" for everyone else</li>
 * </ul>
 *
 * Example: {@code "$You() $conj(attack) $you(goblin)."} reads "You attack goblin." to the
 * attacker, "Bob attacks you." to the goblin and "Bob attacks goblin." to onlookers.
 */
public final class MessageTemplate {

    private static final Pattern TOKEN = Pattern.compile("\\$(You|you|Your|your|conj)\\(([^)]*)\\)");

    private MessageTemplate() {}

    /**
     * Render a template for one viewer.
     * @param template text containing tokens
     * @param source who the message is "from" ({@code $You()} without a key); may be null
     * @param viewer who is reading the message
     * @param mapping key -> combatant used by keyed tokens; may be null
     */
    public static String render(String template, Combatant source, Combatant viewer,
                                Map<String, ? extends Combatant> mapping) {
        if (template == null || template.indexOf('$') < 0) {
            return template;
        }
        Map<String, ? extends Combatant> names = mapping != null ? mapping : Collections.emptyMap();
        Matcher m = TOKEN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String func = m.group(1);
            String arg = m.group(2).trim();
            String replacement;
            if ("conj".equals(func)) {
                replacement = (source != null && source == viewer) ? arg : conjugate(arg);
            } else {
                Combatant subject = arg.isEmpty() ? source : names.get(arg);
                String fallback = arg.isEmpty() ? "someone" : arg;
                replacement = pronoun(func, subject, viewer, fallback);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String pronoun(String func, Combatant subject, Combatant viewer, String fallback) {
        boolean possessive = func.endsWith("r");
        boolean capital = Character.isUpperCase(func.charAt(0));
        if (subject != null && subject == viewer) {
            String word = possessive ? "your" : "you";
            return capital ? capitalize(word) : word;
        }
        String name = subject != null ? subject.getName() : fallback;
        if (subject == null && capital) {
            name = capitalize(name);
        }
        return possessive ? name + "'s" : name;
    }

    /**
     * Third-person singular of a verb: attack -> attacks, flee -> flees, try -> tries.
     */
    public static String conjugate(String verb) {
        if (verb == null || verb.isEmpty()) return verb;
        switch (verb) {
            case "be": return "is";
            case "are": return "is";
            case "have": return "has";
            case "do": return "does";
            case "go": return "goes";
            default: break;
        }
        if (verb.endsWith("s") || verb.endsWith("sh") || verb.endsWith("ch")
                || verb.endsWith("x") || verb.endsWith("z") || verb.endsWith("o")) {
            return verb + "es";
        }
        if (verb.length() > 1 && verb.endsWith("y") && !isVowel(verb.charAt(verb.length() - 2))) {
            return verb.substring(0, verb.length() - 1) + "ies";
        }
        return verb + "s";
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(Character.toLowerCase(c)) >= 0;
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
