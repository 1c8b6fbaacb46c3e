package com.structuredtables.parser;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.structuredtables.util.TermNameUtil;

/**
 * Mutable declarations a parser has seen so far: synonyms, value-name remappings
 * and the current parameter map. Keys are normalized once on insertion; a later
 * declaration for the same key replaces the earlier one.
 */
public class ParserState {
    private final Map<String, String> synonyms = new HashMap<>();
    private final Map<String, String> valueNames = new HashMap<>();
    private List<String> paramMap = List.of();

    public ParserState() {
    }

    private ParserState(ParserState other) {
        this.synonyms.putAll(other.synonyms);
        this.valueNames.putAll(other.valueNames);
        this.paramMap = other.paramMap;
    }

    public ParserState copy() {
        return new ParserState(this);
    }

    public void addSynonym(String alias, String canonical) {
        synonyms.put(TermNameUtil.key(alias), TermNameUtil.key(canonical));
    }

    public Optional<String> synonymFor(String termCell) {
        return Optional.ofNullable(synonyms.get(TermNameUtil.key(termCell)));
    }

    public void addValueName(String recordTerm, String valueName) {
        valueNames.put(TermNameUtil.key(recordTerm), valueName.trim());
    }

    public String valueNameFor(String recordTerm) {
        return valueNames.getOrDefault(TermNameUtil.key(recordTerm), Term.DEFAULT_VALUE_NAME);
    }

    public List<String> getParamMap() {
        return paramMap;
    }

    public void setParamMap(List<String> params) {
        this.paramMap = params == null ? List.of() : List.copyOf(params);
    }

    public Map<String, String> getSynonyms() {
        return Map.copyOf(synonyms);
    }

    public Map<String, String> getValueNames() {
        return Map.copyOf(valueNames);
    }
}
