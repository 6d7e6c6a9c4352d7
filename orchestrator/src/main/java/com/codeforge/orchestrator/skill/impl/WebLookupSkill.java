package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Fetches a documentation page over HTTP(S) and returns its body, truncated.
 */
@Component
public class WebLookupSkill implements Skill<ToolArguments, String> {

    static final int MAX_CHARS = 5_000;

    private static final SkillManifest MANIFEST = new SkillManifest(
            "web_lookup", "1.0.0",
            "web_lookup(url: str) -> str",
            "Fetch a documentation page (http or https). Returns at most 5000 characters of the body.",
            ExecutionTarget.NETWORK);

    private static final SkillPolicy POLICY = SkillPolicy.network(20, 5);

    private final HttpClient httpClient;

    public WebLookupSkill() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    WebLookupSkill(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        URI uri = parse(args.requireString("url"));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(POLICY.commandTimeoutSec()))
                .header("User-Agent", "codeforge/1.0")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new SkillException(SkillException.Kind.TOOL_ERROR,
                        "HTTP " + response.statusCode() + " from " + uri);
            }
            return truncate(response.body());
        } catch (HttpTimeoutException e) {
            throw new SkillException(SkillException.Kind.TIMEOUT, "Timed out fetching " + uri, e);
        } catch (IOException e) {
            throw new SkillException(SkillException.Kind.TOOL_ERROR, "Failed to fetch " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SkillException(SkillException.Kind.TOOL_ERROR, "Interrupted fetching " + uri, e);
        }
    }

    static URI parse(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS, "malformed url '" + url + "'", e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "only absolute http(s) urls are allowed, got '" + url + "'");
        }
        return uri;
    }

    static String truncate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_CHARS ? body : body.substring(0, MAX_CHARS) + "\n... (truncated)";
    }
}
