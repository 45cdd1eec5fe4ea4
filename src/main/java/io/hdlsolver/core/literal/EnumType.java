/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.ENUM_MEMBER_UNKNOWN;
import static java.util.Collections.unmodifiableList;

/**
 * A finite enumeration declared by the front end, e.g. a capacitor's temperature coefficient.
 * Members are ordered by declaration.
 */
public class EnumType {

    private final String name;
    private final List<Member> members;

    private EnumType(String name, List<String> memberNames) {
        this.name = name;
        List<Member> members = new ArrayList<>();
        for (String memberName : memberNames) members.add(new Member(this, memberName, members.size()));
        this.members = unmodifiableList(members);
    }

    public static EnumType of(String name, String... members) {
        return new EnumType(name, List.of(members));
    }

    public String name() {
        return name;
    }

    public List<Member> members() {
        return members;
    }

    public Member member(String name) {
        for (Member member : members) {
            if (member.name.equals(name)) return member;
        }
        throw SolverException.of(ENUM_MEMBER_UNKNOWN, this.name, name);
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Member implements Comparable<Member> {

        private final EnumType type;
        private final String name;
        private final int ordinal;

        private Member(EnumType type, String name, int ordinal) {
            this.type = type;
            this.name = name;
            this.ordinal = ordinal;
        }

        public EnumType type() {
            return type;
        }

        public String name() {
            return name;
        }

        public int ordinal() {
            return ordinal;
        }

        @Override
        public int compareTo(Member other) {
            return Integer.compare(ordinal, other.ordinal);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Member that = (Member) o;
            return type == that.type && ordinal == that.ordinal;
        }

        @Override
        public int hashCode() {
            return Objects.hash(type.name, ordinal);
        }

        @Override
        public String toString() {
            return type.name + "." + name;
        }
    }
}
