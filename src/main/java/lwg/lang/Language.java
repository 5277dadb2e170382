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
package lwg.lang;

/**
 * The three languages of the hierarchy, with the file suffix each is stored under.
 */
public enum Language {
	LOOP("loop"),
	WHILE("while"),
	GOTO("goto");

	private final String suffix;

	Language(String suffix) {
		this.suffix = suffix;
	}

	/**
	 * Determine the language of a file from its extension.
	 *
	 * @param fileName any file name or path.
	 * @return null if the extension is not one of ".loop", ".while" or ".goto".
	 */
	public static Language fromFileName(String fileName) {
		final int dot = fileName.lastIndexOf('.');
		if (dot < 0) {
			return null;
		}
		final String ext = fileName.substring(dot + 1).toLowerCase();
		for (Language lang : values()) {
			if (lang.suffix.equals(ext)) {
				return lang;
			}
		}
		return null;
	}
}
