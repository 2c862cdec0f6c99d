package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Builds the absolute URLs the payer is sent to.
 *
 * <p>Targets are resolved against {@code app.checkout.site-base-url}. Carried-forward hints
 * ({@code redirect_to}, {@code redirect_message}) are always percent-encoded query parameters. An override
 * target pointing at another host is ignored, so the redirect never leaves the site. Characters not allowed in a
 * URI (spaces, non-ASCII) are percent-encoded; an override that still cannot be parsed falls back to the default
 * target.</p>
 */
@Component
public class RedirectBuilder {

    private static final Logger log = LoggerFactory.getLogger(RedirectBuilder.class);

    /** Query parameter carrying the page to continue to. */
    public static final String REDIRECT_TO_PARAM = "redirect_to";

    /** Query parameter carrying the message for the landing page. */
    public static final String REDIRECT_MESSAGE_PARAM = "redirect_message";

    private static final Pattern HAS_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:.*");

    private final AppProperties.Checkout checkout;

    public RedirectBuilder(AppProperties properties) {
        this.checkout = properties.getCheckout();
    }

    /**
     * Builds a redirect URL.
     *
     * @param defaultTarget path (optionally with query) used when no override is given
     * @param overrideTarget replaces {@code defaultTarget} entirely when present
     * @param redirectTo appended as {@code redirect_to} when present
     * @param redirectMessage appended as {@code redirect_message} when present
     * @return absolute URL
     */
    public String build(String defaultTarget, String overrideTarget, String redirectTo, String redirectMessage) {
        String base = null;
        if (hasText(overrideTarget)) {
            if (!isSameSite(overrideTarget)) {
                log.warn("Ignoring off-site redirect override. target={}", overrideTarget);
            } else {
                base = toUri(absolute(overrideTarget));
                if (base == null) {
                    log.warn("Ignoring malformed redirect override. target={}", overrideTarget);
                }
            }
        }
        if (base == null) {
            String fallback = absolute(defaultTarget);
            base = Objects.requireNonNullElse(toUri(fallback), fallback);
        }

        StringBuilder url = new StringBuilder(base);
        appendParam(url, REDIRECT_TO_PARAM, redirectTo);
        appendParam(url, REDIRECT_MESSAGE_PARAM, redirectMessage);
        return url.toString();
    }

    /**
     * Default success target: {@code <success-path>?doctype=<type>&docname=<id>}.
     *
     * @param referenceType reference record type
     * @param referenceId reference record id
     * @return relative target
     */
    public String successTarget(String referenceType, String referenceId) {
        return checkout.getSuccessPath()
                + "?doctype=" + UriUtils.encode(referenceType, StandardCharsets.UTF_8)
                + "&docname=" + UriUtils.encode(referenceId, StandardCharsets.UTF_8);
    }

    public String failureTarget() {
        return checkout.getFailurePath();
    }

    /**
     * URL the provider sends the payer back to, for both success and failure. It carries no outcome:
     * the outcome is always re-queried from the provider.
     *
     * @param token checkout token
     * @return absolute confirmation URL
     */
    public String confirmationUrl(String token) {
        return absolute(checkout.getConfirmPath()) + "?token=" + UriUtils.encode(token, StandardCharsets.UTF_8);
    }

    private String absolute(String target) {
        String t = target == null ? "" : target.trim();
        if (HAS_SCHEME.matcher(t).matches()) {
            return t;
        }
        String base = checkout.getSiteBaseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        while (t.startsWith("/")) {
            t = t.substring(1);
        }
        return base + "/" + t;
    }

    private static String toUri(String url) {
        try {
            return URI.create(url).toASCIIString();
        } catch (IllegalArgumentException notYetEncoded) {
            try {
                String encoded = UriComponentsBuilder.fromUriString(url).build().encode().toUriString();
                return URI.create(encoded).toASCIIString();
            } catch (IllegalArgumentException | IllegalStateException unusable) {
                return null;
            }
        }
    }

    private boolean isSameSite(String target) {
        String t = target.trim();
        if (t.startsWith("//") || t.contains("\\")) {
            return false;
        }
        if (!HAS_SCHEME.matcher(t).matches()) {
            return true;
        }
        try {
            UriComponents candidate = UriComponentsBuilder.fromUriString(t).build();
            UriComponents site = UriComponentsBuilder.fromUriString(checkout.getSiteBaseUrl()).build();
            return site.getScheme() != null
                    && site.getScheme().equalsIgnoreCase(candidate.getScheme())
                    && site.getHost() != null
                    && site.getHost().equalsIgnoreCase(candidate.getHost())
                    && site.getPort() == candidate.getPort();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void appendParam(StringBuilder url, String name, String value) {
        if (!hasText(value)) {
            return;
        }
        url.append(url.indexOf("?") >= 0 ? '&' : '?')
                .append(name)
                .append('=')
                .append(UriUtils.encode(value, StandardCharsets.UTF_8));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
