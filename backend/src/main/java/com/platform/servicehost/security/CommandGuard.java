package com.platform.servicehost.security;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gates process-argument strings against command chaining and substitution.
 *
 * Policy is validate-then-reject: legitimate input is passed on exactly as typed,
 * including double-quoted tokens with spaces. {@link #sanitize(String)} exists for
 * rendering rejected input in logs and messages, never for building a command line.
 *
 * Arguments that cmd.exe will parse (batch executables, or the restart-on-exit
 * wrapper) go through a stricter check: cmd metacharacters are rejected even
 * inside double quotes.
 */
@Component
public class CommandGuard {
    
    /**
     * Longest command line CreateProcess accepts.
     */
    public static final int MAX_ARGUMENT_LENGTH = 8191;
    
    private static final List<String> CHAINING_SEQUENCES = List.of("&&", "||", ";", "`", "$(");
    
    private static final Pattern VARIABLE_EXPANSION = Pattern.compile("%[^%]*%");
    
    private static final String COMMAND_INTERPRETER_METACHARACTERS = "&|<>^%!";
    
    private static final Set<String> COMMAND_INTERPRETER_EXTENSIONS = Set.of(".bat", ".cmd");
    
    private static final Set<String> ALLOWED_EXECUTABLE_EXTENSIONS = Set.of(
        ".exe", ".bat", ".cmd", ".ps1", ".py", ".js", ".vbs", ".wsf", ".com"
    );
    
    public GuardResult validate(String arguments) {
        return validate(arguments, false);
    }
    
    /**
     * @param commandInterpreted true when cmd.exe parses the argument string
     */
    public GuardResult validate(String arguments, boolean commandInterpreted) {
        if (arguments == null || arguments.isEmpty()) {
            return GuardResult.accept();
        }
        if (arguments.length() > MAX_ARGUMENT_LENGTH) {
            return GuardResult.reject("Arguments exceed maximum length of " + MAX_ARGUMENT_LENGTH);
        }
        if (arguments.indexOf('\n') >= 0 || arguments.indexOf('\r') >= 0 || arguments.indexOf('\0') >= 0) {
            return GuardResult.reject("Arguments must be a single line");
        }
        for (String sequence : CHAINING_SEQUENCES) {
            if (arguments.contains(sequence)) {
                return GuardResult.reject("Arguments contain forbidden sequence '" + sequence + "'");
            }
        }
        if (VARIABLE_EXPANSION.matcher(arguments).find()) {
            return GuardResult.reject("Arguments contain environment variable expansion");
        }
        if (commandInterpreted) {
            for (int i = 0; i < arguments.length(); i++) {
                char c = arguments.charAt(i);
                if (COMMAND_INTERPRETER_METACHARACTERS.indexOf(c) >= 0) {
                    return GuardResult.reject("Arguments passed through cmd.exe must not contain '" + c + "'");
                }
            }
        }
        
        boolean inQuotes = false;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '"' && !isEscaped(arguments, i)) {
                inQuotes = !inQuotes;
            } else if (c == '|' && !inQuotes && !isEscaped(arguments, i)) {
                return GuardResult.reject("Arguments contain an unescaped pipe");
            } else if (c == '&' && !inQuotes && !isEscaped(arguments, i)) {
                return GuardResult.reject("Arguments contain an unquoted '&'");
            } else if ((c == '<' || c == '>') && !inQuotes) {
                return GuardResult.reject("Arguments contain redirection '" + c + "'");
            }
        }
        if (inQuotes) {
            return GuardResult.reject("Arguments contain an unterminated quote");
        }
        
        return GuardResult.accept();
    }
    
    public boolean isValid(String arguments) {
        return validate(arguments).accepted();
    }
    
    /**
     * Display-safe rendering: strips chaining characters and control characters.
     */
    public String sanitize(String arguments) {
        if (arguments == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(Math.min(arguments.length(), 256));
        for (int i = 0; i < arguments.length() && out.length() < 256; i++) {
            char c = arguments.charAt(i);
            if (c == '&' || c == '|' || c == ';' || c == '`' || c == '$' || Character.isISOControl(c)) {
                continue;
            }
            out.append(c);
        }
        return out.toString().trim();
    }
    
    /**
     * File-type allow-list for the hosted executable; a name without extension passes.
     */
    public GuardResult validateExecutableType(String executablePath) {
        if (executablePath == null || executablePath.isBlank()) {
            return GuardResult.reject("Executable path is empty");
        }
        String fileName = executablePath.substring(
            Math.max(executablePath.lastIndexOf('/'), executablePath.lastIndexOf('\\')) + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return GuardResult.accept();
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        if (!ALLOWED_EXECUTABLE_EXTENSIONS.contains(extension)) {
            return GuardResult.reject("Executable type not allowed: " + extension);
        }
        return GuardResult.accept();
    }
    
    /**
     * True for executables that Windows hands to cmd.exe.
     */
    public boolean runsThroughCommandInterpreter(String executablePath) {
        if (executablePath == null) {
            return false;
        }
        String lower = executablePath.toLowerCase(Locale.ROOT);
        return COMMAND_INTERPRETER_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
    
    private static boolean isEscaped(String value, int index) {
        if (index == 0) {
            return false;
        }
        char previous = value.charAt(index - 1);
        return previous == '\\' || previous == '^';
    }
}
