@NullMarked
package org.springaicommunity.jira.corpus.cli;

import org.jspecify.annotations.NullMarked;
