import Frontend.AnalysisException;
import Frontend.AnalysisResult;
import Frontend.AnalysisStats;
import Frontend.Detector.DetectionResult;
import Frontend.Detector.LanguageDetector;
import Frontend.LexicalAnalyzer;
import Frontend.Lexer.Language;
import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;
import Frontend.Lexer.TokenStream;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 命令行入口: Analyzer [-l c|cpp|python] [--detect] [--tokens] [-o 输出文件] 源文件
 */
public class Analyzer {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String sourcePath = null;
        String outputPath = null;
        String language = null;
        boolean detectOnly = false;
        boolean dumpTokens = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-l":
                case "--language":
                    if (i + 1 < args.length) {
                        language = args[++i];
                    } else {
                        err.println("error: " + arg + " requires a language (c, cpp, python)");
                        return 1;
                    }
                    break;
                case "-o":
                    if (i + 1 < args.length) {
                        outputPath = args[++i];
                    } else {
                        err.println("error: -o requires an output file");
                        return 1;
                    }
                    break;
                case "--detect":
                    detectOnly = true;
                    break;
                case "--tokens":
                    dumpTokens = true;
                    break;
                default:
                    if (!arg.startsWith("-")) {
                        sourcePath = arg;
                    } else {
                        err.println("warning: unknown option " + arg);
                    }
                    break;
            }
        }

        if (sourcePath == null) {
            err.println("usage: Analyzer [-l c|cpp|python] [--detect] [--tokens] [-o <file>] <source-file>");
            return 1;
        }
        if (language != null && Language.fromId(language).isEmpty()) {
            err.println("warning: unsupported language '" + language + "', falling back to auto-detection");
        }

        String source;
        try {
            source = Files.readString(Path.of(sourcePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("error: cannot read " + sourcePath + ": " + e.getMessage());
            return 1;
        }

        String output;
        if (detectOnly) {
            output = GSON.toJson(detectionJson(LanguageDetector.detect(source)));
        } else {
            AnalysisResult result;
            try {
                result = LexicalAnalyzer.analyze(source, language);
            } catch (AnalysisException e) {
                err.println("error: " + e.getMessage());
                if (e.getDetection() != null) {
                    err.println(GSON.toJson(detectionJson(e.getDetection())));
                }
                return 1;
            }
            output = dumpTokens ? tokenDump(result) : GSON.toJson(resultJson(result));
        }

        if (outputPath == null) {
            out.println(output);
            return 0;
        }
        try {
            Files.writeString(Path.of(outputPath), output + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("error: cannot write " + outputPath + ": " + e.getMessage());
            return 1;
        }
        return 0;
    }

    static JsonObject resultJson(AnalysisResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("language", result.getLanguage().getId());
        json.addProperty("confidence", result.getConfidence());
        json.add("tokens", tokensJson(result.getTokens()));
        json.add("errors", tokensJson(result.getErrors()));

        AnalysisStats stats = result.getStats();
        JsonObject statsJson = new JsonObject();
        statsJson.addProperty("total", stats.getTotal());
        JsonObject byKind = new JsonObject();
        for (Map.Entry<TokenKind, Integer> entry : stats.getByKind().entrySet()) {
            byKind.addProperty(entry.getKey().name(), entry.getValue());
        }
        statsJson.add("byKind", byKind);
        statsJson.addProperty("errorCount", stats.getErrorCount());
        json.add("stats", statsJson);
        return json;
    }

    static JsonObject detectionJson(DetectionResult detection) {
        JsonObject json = new JsonObject();
        json.addProperty("language", detection.getLanguage().getId());
        json.addProperty("confidence", detection.getConfidence().id());
        JsonObject scores = new JsonObject();
        for (Map.Entry<Language, Integer> entry : detection.getScores().entrySet()) {
            scores.addProperty(entry.getKey().getId(), entry.getValue());
        }
        json.add("perLanguageScores", scores);
        return json;
    }

    private static JsonArray tokensJson(List<Token> tokens) {
        JsonArray array = new JsonArray();
        for (Token token : tokens) {
            JsonObject json = new JsonObject();
            json.addProperty("kind", token.getKind().name());
            json.addProperty("value", token.getValue());
            json.addProperty("line", token.getLine());
            json.addProperty("column", token.getColumn());
            if (token.isError()) {
                json.addProperty("message", token.getMessage());
            }
            array.add(json);
        }
        return array;
    }

    private static String tokenDump(AnalysisResult result) {
        TokenStream stream = new TokenStream();
        stream.addAll(result.getTokens());
        StringBuilder sb = new StringBuilder(stream.toString());
        for (Token error : result.getErrors()) {
            if (!result.getTokens().contains(error)) {
                sb.append(error).append('\n');
            }
        }
        return sb.toString().stripTrailing();
    }
}
