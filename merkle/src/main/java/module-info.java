// SPDX-License-Identifier: Apache-2.0
module org.hiero.merkle.tree {
    exports org.hiero.merkle.tree;

    requires transitive org.hiero.merkle.common;
    requires static com.github.spotbugs.annotations;
}
