/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.io;

import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Address;
import com.aclforge.api.model.Filter;
import com.aclforge.api.model.Header;
import com.aclforge.api.model.Policy;
import com.aclforge.api.model.PortRange;
import com.aclforge.api.model.Term;
import com.aclforge.api.model.Verbatim;
import com.aclforge.compiler.io.PolicyDefinition.AddressDefinition;
import com.aclforge.compiler.io.PolicyDefinition.FilterDefinition;
import com.aclforge.compiler.io.PolicyDefinition.TargetDefinition;
import com.aclforge.compiler.io.PolicyDefinition.TermDefinition;
import com.aclforge.compiler.io.PolicyDefinition.VerbatimDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Reads a policy from its JSON interchange form.
 *
 * <p>Structural JSON problems surface as {@link IOException}s from Jackson. Values that
 * parse but make no sense (unknown action, malformed CIDR or port) raise
 * {@link ValidationException}.
 */
public class PolicyLoader {
    private static final Logger logger = Logger.getLogger(PolicyLoader.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    public Policy load(Path path) throws IOException {
        String content = Files.readString(path);
        Policy policy = read(content);
        logger.info(String.format("Loaded %d filter(s) from %s", policy.filters().size(), path));
        return policy;
    }

    public Policy read(InputStream in) throws IOException {
        return toPolicy(objectMapper.readValue(in, PolicyDefinition.class));
    }

    public Policy read(String json) throws IOException {
        return toPolicy(objectMapper.readValue(json, PolicyDefinition.class));
    }

    Policy toPolicy(PolicyDefinition definition) {
        if (definition.filters() == null || definition.filters().isEmpty()) {
            throw new ValidationException("Policy must contain at least one filter");
        }
        List<Filter> filters = new ArrayList<>();
        for (FilterDefinition filter : definition.filters()) {
            filters.add(toFilter(filter));
        }
        return new Policy(filters);
    }

    private Filter toFilter(FilterDefinition definition) {
        if (definition.header() == null || definition.header().targets() == null
                || definition.header().targets().isEmpty()) {
            throw new ValidationException("Filter header must name at least one target");
        }
        List<Header.Target> targets = new ArrayList<>();
        for (TargetDefinition target : definition.header().targets()) {
            if (target.platform() == null || target.platform().isBlank()) {
                throw new ValidationException("Header target is missing its platform");
            }
            targets.add(new Header.Target(target.platform(), target.options()));
        }
        Header header = new Header(targets, definition.header().comment());

        List<Term> terms = new ArrayList<>();
        if (definition.terms() != null) {
            for (TermDefinition term : definition.terms()) {
                terms.add(toTerm(term));
            }
        }
        return new Filter(header, terms);
    }

    private Term toTerm(TermDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ValidationException("Term is missing its name");
        }
        String name = definition.name();

        Action action = null;
        if (definition.action() != null) {
            action = Action.fromToken(definition.action());
            if (action == null) {
                throw new ValidationException("Term " + name + " has unknown action: " + definition.action());
            }
        }

        List<Verbatim> verbatim = new ArrayList<>();
        if (definition.verbatim() != null) {
            for (VerbatimDefinition v : definition.verbatim()) {
                verbatim.add(new Verbatim(v.platform(), v.text()));
            }
        }

        return Term.builder(name)
                .action(action)
                .protocols(definition.protocol())
                .protocolExcepts(definition.protocolExcept())
                .sourceAddresses(addresses(name, definition.sourceAddress()))
                .sourceAddressExcludes(addresses(name, definition.sourceAddressExclude()))
                .destinationAddresses(addresses(name, definition.destinationAddress()))
                .destinationAddressExcludes(addresses(name, definition.destinationAddressExclude()))
                .sourcePorts(ports(name, definition.sourcePort()))
                .destinationPorts(ports(name, definition.destinationPort()))
                .icmpTypes(definition.icmpType())
                .options(definition.option())
                .logging(definition.logging())
                .comments(definition.comment())
                .owner(definition.owner())
                .expiration(definition.expiration())
                .platforms(definition.platform())
                .platformExcludes(definition.platformExclude())
                .verbatim(verbatim)
                .statelessReply(definition.statelessReply())
                .counter(definition.counter())
                .policer(definition.policer())
                .qos(definition.qos())
                .lossPriority(definition.lossPriority())
                .routingInstance(definition.routingInstance())
                .packetLength(definition.packetLength())
                .fragmentOffset(definition.fragmentOffset())
                .sourceInterface(definition.sourceInterface())
                .destinationInterface(definition.destinationInterface())
                .sourcePrefixes(definition.sourcePrefix())
                .destinationPrefixes(definition.destinationPrefix())
                .precedence(definition.precedence())
                .build();
    }

    private static List<Address> addresses(String term, List<AddressDefinition> definitions) {
        return convert(term, definitions, a -> {
            if (a.cidr() == null) {
                throw new IllegalArgumentException("address entry has no cidr");
            }
            return Address.parse(a.cidr(), a.token(), a.comment());
        });
    }

    private static List<PortRange> ports(String term, List<String> definitions) {
        return convert(term, definitions, PolicyLoader::parsePort);
    }

    static PortRange parsePort(String value) {
        int dash = value.indexOf('-');
        if (dash < 0) {
            return PortRange.of(Integer.parseInt(value.trim()));
        }
        return PortRange.of(Integer.parseInt(value.substring(0, dash).trim()),
                Integer.parseInt(value.substring(dash + 1).trim()));
    }

    private static <D, T> List<T> convert(String term, List<D> definitions, Function<D, T> converter) {
        List<T> values = new ArrayList<>();
        if (definitions == null) {
            return values;
        }
        for (D definition : definitions) {
            try {
                values.add(converter.apply(definition));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Term " + term + " has an invalid value " + definition
                        + ": " + e.getMessage(), e);
            }
        }
        return values;
    }
}
