package me.christianrobert.onig2js.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.onig2js.config.service.ConfigService;
import me.christianrobert.onig2js.transformer.builder.JsRegexBuilder;
import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.ConversionException;
import me.christianrobert.onig2js.transformer.context.ConversionOptions;
import me.christianrobert.onig2js.transformer.context.ConversionResult;
import me.christianrobert.onig2js.transformer.leaf.LiteralNormalizer;
import me.christianrobert.onig2js.transformer.leaf.PropertyResolver;
import me.christianrobert.onig2js.transformer.node.RootNode;
import me.christianrobert.onig2js.transformer.util.NodeTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts parsed Onigmo pattern trees into ECMAScript patterns.
 *
 * <p>Architecture:
 * <pre>
 * RootNode → ConversionContext + JsRegexBuilder → pattern, flags, warnings
 *                      ↓                ↓
 *              per-call state     static VisitXxx helpers
 * </pre>
 *
 * <p>Every call gets a fresh context, so the service itself is stateless and
 * may be shared between threads. Unsupported features never fail a conversion;
 * they are dropped or approximated and reported as warnings. Only malformed
 * trees and trees nested deeper than the configured bound produce a failed
 * result.</p>
 */
@ApplicationScoped
public class RegexConversionService {

    private static final Logger log = LoggerFactory.getLogger(RegexConversionService.class);

    @Inject
    ConfigService configService;

    @Inject
    PropertyResolver propertyResolver;

    @Inject
    LiteralNormalizer literalNormalizer;

    public RegexConversionService() {
    }

    public RegexConversionService(ConfigService configService, PropertyResolver propertyResolver,
                                  LiteralNormalizer literalNormalizer) {
        this.configService = configService;
        this.propertyResolver = propertyResolver;
        this.literalNormalizer = literalNormalizer;
    }

    /**
     * Converts a tree using the configured options.
     *
     * @param root Parsed pattern
     * @return ConversionResult containing either the pattern or error details
     */
    public ConversionResult convert(RootNode root) {
        return convert(root, defaultOptions());
    }

    /**
     * Converts a tree, overriding whether the {@code g} flag is emitted.
     */
    public ConversionResult convert(RootNode root, boolean addGlobalFlag) {
        return convert(root, defaultOptions().withAddGlobalFlag(addGlobalFlag));
    }

    /**
     * Converts a tree with explicit options.
     *
     * <p>This is the master conversion method that all other overloads delegate to.</p>
     *
     * @param root Parsed pattern
     * @param options Conversion options
     * @return ConversionResult containing either the pattern or error details
     * @throws IllegalArgumentException if root or options are null
     */
    public ConversionResult convert(RootNode root, ConversionOptions options) {
        if (root == null) {
            throw new IllegalArgumentException("Pattern tree cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("Conversion options cannot be null");
        }

        String source = root.getText();
        log.debug("Converting pattern: {}", source);

        ConversionContext context = new ConversionContext(options, root.isCaseInsensitive(), root.isDotAll());
        JsRegexBuilder builder = new JsRegexBuilder(context, propertyResolver, literalNormalizer);

        try {
            String pattern = builder.build(root);
            String flags = flags(root, options);

            if (context.getWarnings().isEmpty()) {
                log.debug("Converted '{}' to '{}'", source, pattern);
            } else {
                log.info("Converted '{}' to '{}' with {} warning(s)", source, pattern, context.getWarnings().size());
                context.getWarnings().forEach(warning -> log.debug("  {}", warning));
            }

            if (options.isIncludeNodeTree()) {
                return ConversionResult.successWithTree(source, pattern, flags, context.getWarnings(),
                        NodeTreeFormatter.format(root));
            }
            return ConversionResult.success(source, pattern, flags, context.getWarnings());

        } catch (ConversionException e) {
            log.warn("Conversion failed: {}", e.getDetailedMessage());
            return ConversionResult.failure(source, e);
        }
    }

    /**
     * Options derived from the configuration service, or the defaults if none is available.
     */
    public ConversionOptions defaultOptions() {
        return configService != null ? configService.getConversionOptions() : ConversionOptions.defaults();
    }

    private static String flags(RootNode root, ConversionOptions options) {
        StringBuilder flags = new StringBuilder();
        if (options.isAddGlobalFlag()) {
            flags.append('g');
        }
        if (root.isCaseInsensitive()) {
            flags.append('i');
        }
        return flags.toString();
    }
}
