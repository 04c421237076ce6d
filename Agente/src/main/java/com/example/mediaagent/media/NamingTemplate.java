package com.example.mediaagent.media;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template de nome de arquivo/subpasta.
 *
 * Tokens suportados:
 * <ul>
 *   <li>{@code {date:padrao}}: data de modificação formatada com {@link DateTimeFormatter}</li>
 *   <li>{@code {name}}: nome original sem extensão</li>
 *   <li>{@code {ext}}: extensão original com o ponto, em minúsculas</li>
 *   <li>{@code {seq}}: número de sequência armazenado (4 dígitos)</li>
 *   <li>{@code {today}}: downloads de hoje (contador do dia)</li>
 *   <li>{@code {jobcode}}: código de trabalho</li>
 *   <li>{@code {device}}: nome do dispositivo de origem</li>
 * </ul>
 */
public final class NamingTemplate {

    private static final Pattern TOKEN = Pattern.compile("\\{([a-zA-Z]+)(?::([^}]*))?}");
    private static final Set<String> KNOWN = Set.of("date", "name", "ext", "seq", "today", "jobcode", "device");
    private static final Pattern ILLEGAL = Pattern.compile("[\\\\:*?\"<>|\\x00-\\x1f]");

    private final String template;
    private final boolean allowSubfolders;

    private NamingTemplate(String template, boolean allowSubfolders) {
        this.template = Objects.requireNonNull(template, "template");
        this.allowSubfolders = allowSubfolders;
    }

    /** Template de nome de arquivo: '/' é substituído. */
    public static NamingTemplate fileName(String template) {
        return new NamingTemplate(template, false);
    }

    /** Template de subpasta: '/' separa níveis. */
    public static NamingTemplate subfolder(String template) {
        return new NamingTemplate(template, true);
    }

    public String template() {
        return template;
    }

    public boolean usesJobCode() {
        return tokens().contains("jobcode");
    }

    public boolean usesSequence() {
        List<String> t = tokens();
        return t.contains("seq") || t.contains("today");
    }

    /**
     * Problemas do template (token desconhecido, padrão de data inválido, vazio).
     * Lista vazia significa template válido.
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (!allowSubfolders && template.isBlank()) {
            problems.add("Template de nome vazio");
            return problems;
        }
        Matcher m = TOKEN.matcher(template);
        while (m.find()) {
            String token = m.group(1).toLowerCase(Locale.ROOT);
            if (!KNOWN.contains(token)) {
                problems.add("Token desconhecido: {" + m.group(1) + "}");
            } else if (token.equals("date")) {
                try {
                    DateTimeFormatter.ofPattern(m.group(2) == null ? "" : m.group(2));
                } catch (IllegalArgumentException e) {
                    problems.add("Padrão de data inválido: " + m.group(2));
                }
            }
        }
        return problems;
    }

    private List<String> tokens() {
        List<String> out = new ArrayList<>();
        Matcher m = TOKEN.matcher(template);
        while (m.find()) {
            out.add(m.group(1).toLowerCase(Locale.ROOT));
        }
        return out;
    }

    /**
     * Gera o nome/caminho relativo para o contexto informado.
     */
    public String render(Context ctx) {
        Objects.requireNonNull(ctx, "ctx");
        Matcher m = TOKEN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String token = m.group(1).toLowerCase(Locale.ROOT);
            String value;
            switch (token) {
                case "date":
                    value = DateTimeFormatter.ofPattern(m.group(2) == null ? "yyyyMMdd" : m.group(2))
                            .withZone(ctx.zone)
                            .format(ctx.modifiedAt);
                    break;
                case "name":
                    value = ctx.baseName;
                    break;
                case "ext":
                    value = ctx.extension;
                    break;
                case "seq":
                    value = String.format(Locale.ROOT, "%04d", ctx.sequence);
                    break;
                case "today":
                    value = Integer.toString(ctx.downloadsToday);
                    break;
                case "jobcode":
                    value = ctx.jobCode;
                    break;
                case "device":
                    value = ctx.deviceName;
                    break;
                default:
                    throw new IllegalArgumentException("Token desconhecido: {" + m.group(1) + "}");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        String out = ILLEGAL.matcher(sb.toString()).replaceAll("_");
        if (!allowSubfolders) {
            return out.replace('/', '_');
        }
        while (out.startsWith("/")) {
            out = out.substring(1);
        }
        return out.replace("..", "_");
    }

    /**
     * Valores disponíveis aos tokens para um arquivo.
     */
    public static final class Context {
        private final Instant modifiedAt;
        private final ZoneId zone;
        private final String baseName;
        private final String extension;
        private final int sequence;
        private final int downloadsToday;
        private final String jobCode;
        private final String deviceName;

        public Context(Instant modifiedAt, ZoneId zone, String fileName, int sequence,
                       int downloadsToday, String jobCode, String deviceName) {
            this.modifiedAt = Objects.requireNonNull(modifiedAt, "modifiedAt");
            this.zone = Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(fileName, "fileName");
            int dot = fileName.lastIndexOf('.');
            this.baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
            this.extension = dot > 0 ? fileName.substring(dot).toLowerCase(Locale.ROOT) : "";
            this.sequence = sequence;
            this.downloadsToday = downloadsToday;
            this.jobCode = jobCode == null ? "" : jobCode;
            this.deviceName = deviceName == null ? "" : deviceName;
        }
    }
}
