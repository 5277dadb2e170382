// Copyright 2026 The LWG Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package lwg.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import lwg.io.GotoParser;
import lwg.io.LoopParser;
import lwg.io.SyntaxError;
import lwg.io.WhileParser;
import lwg.lang.Language;
import lwg.lang.Program;

/**
 * The text of one LOOP, WHILE or GOTO program, plus the language it is written
 * in. The normal extensions are ".loop", ".while" and ".goto".
 *
 * @author The LWG Project Developers
 */
public class SourceFile {
	/** Where programs are looked for when a name does not resolve as given. */
	public static final String EXAMPLES_DIR = "examples";

	private final String name;
	private final Language language;
	private final String contents;

	public SourceFile(String name, Language language, String contents) {
		this.name = name;
		this.language = language;
		this.contents = contents;
	}

	/**
	 * Read a program from disk, taking its language from the file extension.
	 *
	 * @param path
	 * @return the source file.
	 * @throws IllegalArgumentException if the extension is not a known language.
	 * @throws IOException
	 */
	public static SourceFile read(Path path) throws IOException {
		final String fileName = path.getFileName().toString();
		final Language lang = Language.fromFileName(fileName);
		if (lang == null) {
			throw new IllegalArgumentException("Cannot detect language of " + fileName
					+ ". Use .loop, .while, or .goto extension.");
		}
		final String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		return new SourceFile(fileName, lang, text);
	}

	/**
	 * Find a program file. If the name does not exist as given, it is looked
	 * for in the examples directory instead.
	 *
	 * @return the first path that exists, or the name as given if neither does.
	 */
	public static Path resolve(String name) {
		final Path given = Paths.get(name);
		if (Files.exists(given)) {
			return given;
		}
		final Path example = Paths.get(EXAMPLES_DIR, name);
		if (Files.exists(example)) {
			return example;
		}
		return given;
	}

	public String getName() {
		return this.name;
	}

	public Language getLanguage() {
		return this.language;
	}

	public String getContents() {
		return this.contents;
	}

	/**
	 * Parse this file with the parser for its language.
	 *
	 * @throws SyntaxError
	 */
	public Program parse() {
		switch (this.language) {
		case LOOP:
			return new LoopParser(this.contents).parse();
		case WHILE:
			return new WhileParser(this.contents).parse();
		case GOTO:
			return new GotoParser(this.contents).parse();
		default:
			throw new IllegalStateException("unknown language " + this.language);
		}
	}

	@Override
	public String toString() {
		return this.name;
	}
}
