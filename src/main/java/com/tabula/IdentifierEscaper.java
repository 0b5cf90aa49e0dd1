/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tabula;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Renders schema, table and column names safely into generated SQL.
 * <p>
 * A name is emitted bare if it is a plain identifier ({@code [A-Za-z_][A-Za-z0-9_]*}) that is not a reserved word.
 * Anything else is wrapped in double quotes, with embedded double quotes doubled.
 * <p>
 * This is the only protection against injection through identifiers, so every identifier that Tabula interpolates
 * into SQL text goes through an escaper.  Values are never interpolated; they are always bound as parameters.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class IdentifierEscaper {
	@NonNull
	private static final Pattern PLAIN_IDENTIFIER_PATTERN;
	@NonNull
	private static final Set<String> DEFAULT_RESERVED_WORDS;
	@NonNull
	private static final IdentifierEscaper DEFAULT_INSTANCE;

	static {
		PLAIN_IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
		DEFAULT_RESERVED_WORDS = Set.of("select", "from", "where", "insert", "update", "delete", "create", "drop", "alter");
		DEFAULT_INSTANCE = new IdentifierEscaper(DEFAULT_RESERVED_WORDS);
	}

	@NonNull
	private final Set<String> reservedWords;

	private IdentifierEscaper(@NonNull Collection<String> reservedWords) {
		requireNonNull(reservedWords);

		Set<String> normalizedReservedWords = new LinkedHashSet<>(reservedWords.size());

		for (String reservedWord : reservedWords)
			normalizedReservedWords.add(requireNonNull(reservedWord).toLowerCase(Locale.ENGLISH));

		this.reservedWords = Collections.unmodifiableSet(normalizedReservedWords);
	}

	/**
	 * Acquires an escaper which knows about the default reserved words.
	 *
	 * @return the default escaper
	 */
	@NonNull
	public static IdentifierEscaper defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Creates an escaper which quotes the default reserved words plus {@code additionalReservedWords}.
	 *
	 * @param additionalReservedWords extra words to treat as reserved, compared case-insensitively
	 * @return a new escaper
	 */
	@NonNull
	public static IdentifierEscaper withAdditionalReservedWords(@NonNull Collection<String> additionalReservedWords) {
		requireNonNull(additionalReservedWords);

		Set<String> reservedWords = new LinkedHashSet<>(DEFAULT_RESERVED_WORDS);
		reservedWords.addAll(additionalReservedWords);

		return new IdentifierEscaper(reservedWords);
	}

	/**
	 * Escapes a single identifier.
	 *
	 * @param identifier the schema, table or column name to escape
	 * @return {@code identifier} unchanged if it is safe to emit bare, a double-quoted identifier otherwise
	 */
	@NonNull
	public String escape(@NonNull String identifier) {
		requireNonNull(identifier);

		if (PLAIN_IDENTIFIER_PATTERN.matcher(identifier).matches()
				&& !getReservedWords().contains(identifier.toLowerCase(Locale.ENGLISH)))
			return identifier;

		return format("\"%s\"", identifier.replace("\"", "\"\""));
	}

	/**
	 * Is {@code word} quoted by this escaper even though it looks like a plain identifier?
	 *
	 * @param word the word to check
	 * @return {@code true} if {@code word} is reserved
	 */
	@NonNull
	public Boolean isReservedWord(@NonNull String word) {
		requireNonNull(word);
		return getReservedWords().contains(word.toLowerCase(Locale.ENGLISH));
	}

	@NonNull
	public Set<String> getReservedWords() {
		return this.reservedWords;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{reservedWords=%s}", getClass().getSimpleName(), getReservedWords());
	}
}
