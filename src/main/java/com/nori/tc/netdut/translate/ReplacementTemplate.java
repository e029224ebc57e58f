package com.nori.tc.netdut.translate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 규칙 치환 템플릿.
 *
 * 문법:
 * - \N, \NN      : N번 캡처 그룹 (1 이상, 최대 두 자리)
 * - \g&lt;N&gt;  : N번 캡처 그룹 (0 = 전체 매칭)
 * - \g&lt;name&gt; : 이름 있는 캡처 그룹
 * - \\           : 백슬래시 문자
 * - 그 외 escape는 구성 오류
 *
 * 그룹 번호/이름은 생성 시점에 패턴과 대조한다.
 * 매칭에 참여하지 않은 그룹은 빈 문자열로 치환된다.
 */
final class ReplacementTemplate {

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private sealed interface Part permits Literal, NumberRef, NameRef {
    }

    private record Literal(String text) implements Part {
    }

    private record NumberRef(int group) implements Part {
    }

    private record NameRef(String name) implements Part {
    }

    private final String source;
    private final List<Part> parts;

    private ReplacementTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = parts;
    }

    static ReplacementTemplate parse(String template, Pattern pattern) {
        if (template == null) {
            throw new TranslatorConfigException("replacement must not be null (pattern: " + pattern.pattern() + ")");
        }

        int groupCount = pattern.matcher("").groupCount();
        Set<String> names = namedGroups(pattern);

        List<Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int len = template.length();
        int i = 0;

        while (i < len) {
            char c = template.charAt(i);
            if (c != '\\') {
                literal.append(c);
                i++;
                continue;
            }
            if (i + 1 >= len) {
                throw invalid(template, pattern, "dangling backslash");
            }

            char next = template.charAt(i + 1);
            if (next == '\\') {
                literal.append('\\');
                i += 2;
                continue;
            }

            if (Character.isDigit(next)) {
                int end = i + 2;
                if (end < len && Character.isDigit(template.charAt(end))) {
                    end++;
                }
                int group = Integer.parseInt(template.substring(i + 1, end));
                if (group == 0 || group > groupCount) {
                    throw invalid(template, pattern, "no such group \\" + group);
                }
                flush(literal, parts);
                parts.add(new NumberRef(group));
                i = end;
                continue;
            }

            if (next == 'g') {
                int close = template.indexOf('>', i + 2);
                if (i + 2 >= len || template.charAt(i + 2) != '<' || close < 0) {
                    throw invalid(template, pattern, "malformed \\g<...> reference");
                }
                String ref = template.substring(i + 3, close);
                flush(literal, parts);
                parts.add(groupReference(ref, groupCount, names, template, pattern));
                i = close + 1;
                continue;
            }

            throw invalid(template, pattern, "unsupported escape \\" + next);
        }
        flush(literal, parts);

        return new ReplacementTemplate(template, List.copyOf(parts));
    }

    String expand(Matcher matched) {
        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Literal l) {
                out.append(l.text());
            } else if (part instanceof NumberRef n) {
                String g = matched.group(n.group());
                if (g != null) {
                    out.append(g);
                }
            } else if (part instanceof NameRef n) {
                String g = matched.group(n.name());
                if (g != null) {
                    out.append(g);
                }
            }
        }
        return out.toString();
    }

    String source() {
        return source;
    }

    private static Part groupReference(String ref, int groupCount, Set<String> names,
                                       String template, Pattern pattern) {
        if (ref.isEmpty()) {
            throw invalid(template, pattern, "empty \\g<> reference");
        }
        if (ref.chars().allMatch(Character::isDigit)) {
            int group;
            try {
                group = Integer.parseInt(ref);
            } catch (NumberFormatException e) {
                throw invalid(template, pattern, "no such group \\g<" + ref + ">");
            }
            if (group > groupCount) {
                throw invalid(template, pattern, "no such group \\g<" + group + ">");
            }
            return new NumberRef(group);
        }
        if (!names.contains(ref)) {
            throw invalid(template, pattern, "no such group \\g<" + ref + ">");
        }
        return new NameRef(ref);
    }

    private static void flush(StringBuilder literal, List<Part> parts) {
        if (literal.length() > 0) {
            parts.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static Set<String> namedGroups(Pattern pattern) {
        Set<String> names = new HashSet<>();
        Matcher m = NAMED_GROUP.matcher(pattern.pattern());
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private static TranslatorConfigException invalid(String template, Pattern pattern, String reason) {
        return new TranslatorConfigException("invalid replacement '" + template + "' for pattern '"
                + pattern.pattern() + "': " + reason);
    }
}
