package com.yammer.dropwizard.ldap;

import java.security.Principal;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import static com.google.common.base.Preconditions.checkNotNull;

public class User implements Principal {
    private final String name;
    private final ImmutableMap<String, String> attributes;

    public User(String name, Map<String, String> attributes) {
        this.name = checkNotNull(name);
        this.attributes = ImmutableMap.copyOf(attributes);
    }

    @Override
    public String getName() {
        return name;
    }

    public ImmutableMap<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final User that = (User) o;
        return name.equals(that.name) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("attributes", attributes)
                .toString();
    }
}
