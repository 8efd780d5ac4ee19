package edu.uw.treetyper.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.Iterator;
import java.util.NoSuchElementException;

public class Util {

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	public static Iterable<String> readFile(final File filePath) throws IOException {
		if (!filePath.exists()) {
			throw new IOException("File not found: " + filePath.getPath());
		}

		return new Iterable<String>() {

			@Override
			public Iterator<String> iterator() {
				try {
					return readFileLineByLine(filePath);
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
			}
		};
	}

	public static Iterator<String> readFileLineByLine(final File filePath) throws IOException {
		return new Iterator<String>() {

			final BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(filePath),
					StandardCharsets.UTF_8));

			String next = br.readLine();

			@Override
			public boolean hasNext() {
				final boolean result = (next != null);
				if (!result) {
					try {
						br.close();
					} catch (final IOException e) {
						throw new UncheckedIOException(e);
					}
				}

				return result;
			}

			@Override
			public String next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				final String result = next;
				try {
					next = br.readLine();
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
				return result;
			}
		};
	}

	/**
	 * Finds the index of the bracket closing the one at startIndex. The open and close characters are given, so this
	 * works for (), [], {} and <>.
	 */
	public static int findClosingBracket(final String source, final int startIndex, final char open, final char close) {
		int openBrackets = 0;
		for (int i = startIndex; i < source.length(); i++) {
			if (source.charAt(i) == open) {
				openBrackets++;
			} else if (source.charAt(i) == close) {
				openBrackets--;
			}

			if (openBrackets == 0) {
				return i;
			}
		}

		return -1;
	}

	/**
	 * Finds the first index of a needle character in the haystack, that is not nested in angle brackets.
	 */
	public static int findNonNestedChar(final String haystack, final String needles) {
		int openBrackets = 0;

		for (int i = 0; i < haystack.length(); i++) {
			if (haystack.charAt(i) == '<') {
				openBrackets++;
			} else if (haystack.charAt(i) == '>') {
				openBrackets--;
			} else if (openBrackets == 0) {
				for (int j = 0; j < needles.length(); j++) {
					if (haystack.charAt(i) == needles.charAt(j)) {
						return i;
					}
				}
			}
		}

		return -1;
	}

	public static String capitalize(final String text) {
		if (text.isEmpty()) {
			return text;
		}
		return text.substring(0, 1).toUpperCase() + text.substring(1);
	}

	/**
	 * Writes timestamped messages to stderr, and optionally appends them to a file.
	 */
	public static class Logger {
		private final File file;
		private final SimpleDateFormat format = new SimpleDateFormat("HH:mm:ss");

		public Logger(final File file) {
			this.file = file;
		}

		public Logger() {
			this(null);
		}

		public void log(final String message) {
			final String toWrite = format.format(Calendar.getInstance().getTime()) + "\t" + message;
			System.err.println(toWrite);
			if (file == null) {
				return;
			}

			try (PrintWriter out = new PrintWriter(new BufferedWriter(new FileWriter(file, StandardCharsets.UTF_8,
					true)))) {
				out.println(toWrite);
			} catch (final IOException e) {
				System.err.println("ERROR WRITING TO LOG FILE: " + file.getAbsolutePath());
			}
		}
	}
}
