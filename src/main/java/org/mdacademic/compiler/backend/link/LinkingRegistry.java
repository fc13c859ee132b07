package org.mdacademic.compiler.backend.link;

import org.mdacademic.compiler.backend.link.features.BibliographyLinkingRule;
import org.mdacademic.compiler.backend.link.features.LabelLinkingRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for linking rules. Rules are tried in registration order; the first that applies wins.
 */
public class LinkingRegistry {

    private final List<ILinkingRule> rules = new ArrayList<>();

    /**
     * Registers a new linking rule.
     * @param rule The rule to register.
     */
    public void register(ILinkingRule rule) { rules.add(rule); }

    /**
     * @return The list of registered linking rules.
     */
    public List<ILinkingRule> rules() { return rules; }

    /**
     * Initializes a new linking registry with the default rules: labels first, then bibliography keys.
     * @return A new registry with default rules.
     */
    public static LinkingRegistry initializeWithDefaults() {
        LinkingRegistry reg = new LinkingRegistry();
        reg.register(new LabelLinkingRule());
        reg.register(new BibliographyLinkingRule());
        return reg;
    }
}
