package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A statement carrying {@code @name(expr)} attributes and a {@code { ... }} body.
 */
public abstract class BlockStatement implements Statement {

    protected final Map<String, Expression> attributes;
    protected final List<BodyEntry> body;

    BlockStatement(Map<String, Expression> attributes, List<BodyEntry> body){
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<String, Expression>(attributes));
        this.body = Collections.unmodifiableList(new ArrayList<BodyEntry>(body));
    }

    public Map<String, Expression> getAttributes() {
        return attributes;
    }

    public Expression getAttribute(String name) {
        return attributes.get(name);
    }

    public List<BodyEntry> getBody() {
        return body;
    }

    /**
     * The value of the last {@code key: value} entry with this key, null when absent.
     */
    public Expression findValue(String key) {
        Expression found = null;
        for (BodyEntry entry : body) {
            if (entry.isKeyValue() && entry.getKey().equals(key)) {
                found = entry.getValue();
            }
        }
        return found;
    }

    @Override
    public String toString() {
        return String.format("%s%s%s", getType().tag(), attributes, body);
    }
}
