package com.aclforge.compiler.io;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * JSON representation of a policy. Data transfer objects used only for loading;
 * property names follow the policy-language keywords.
 */
public record PolicyDefinition(
        @JsonProperty("filters") List<FilterDefinition> filters
) {

    public record FilterDefinition(
            @JsonProperty("header") HeaderDefinition header,
            @JsonProperty("terms") List<TermDefinition> terms
    ) {}

    public record HeaderDefinition(
            @JsonProperty("targets") List<TargetDefinition> targets,
            @JsonProperty("comment") List<String> comment
    ) {}

    public record TargetDefinition(
            @JsonProperty("platform") String platform,
            @JsonProperty("options") List<String> options
    ) {}

    /**
     * An address entry: a CIDR string, optionally with the name it was expanded from
     * and an annotation.
     */
    public record AddressDefinition(
            @JsonProperty("cidr") String cidr,
            @JsonProperty("token") String token,
            @JsonProperty("comment") String comment
    ) {}

    public record VerbatimDefinition(
            @JsonProperty("platform") String platform,
            @JsonProperty("text") String text
    ) {}

    public record TermDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("action") String action,
            @JsonProperty("protocol") List<String> protocol,
            @JsonProperty("protocol_except") List<String> protocolExcept,
            @JsonProperty("source_address") List<AddressDefinition> sourceAddress,
            @JsonProperty("source_address_exclude") List<AddressDefinition> sourceAddressExclude,
            @JsonProperty("destination_address") List<AddressDefinition> destinationAddress,
            @JsonProperty("destination_address_exclude") List<AddressDefinition> destinationAddressExclude,
            @JsonProperty("source_port") List<String> sourcePort,
            @JsonProperty("destination_port") List<String> destinationPort,
            @JsonProperty("icmp_type") List<String> icmpType,
            @JsonProperty("option") List<String> option,
            @JsonProperty("logging") String logging,
            @JsonProperty("comment") List<String> comment,
            @JsonProperty("owner") String owner,
            @JsonProperty("expiration") LocalDate expiration,
            @JsonProperty("platform") List<String> platform,
            @JsonProperty("platform_exclude") List<String> platformExclude,
            @JsonProperty("verbatim") List<VerbatimDefinition> verbatim,
            @JsonProperty("stateless_reply") Boolean statelessReply,
            @JsonProperty("counter") String counter,
            @JsonProperty("policer") String policer,
            @JsonProperty("qos") String qos,
            @JsonProperty("loss_priority") String lossPriority,
            @JsonProperty("routing_instance") String routingInstance,
            @JsonProperty("packet_length") String packetLength,
            @JsonProperty("fragment_offset") String fragmentOffset,
            @JsonProperty("source_interface") String sourceInterface,
            @JsonProperty("destination_interface") String destinationInterface,
            @JsonProperty("source_prefix") List<String> sourcePrefix,
            @JsonProperty("destination_prefix") List<String> destinationPrefix,
            @JsonProperty("precedence") List<Integer> precedence
    ) {

        public Boolean statelessReply() {
            return statelessReply != null ? statelessReply : false;
        }
    }
}
