package com.juanpa.solang.transpiler.util;

public class Debug
{
	/**
	 * Master switch for all debug logging. Off unless the driver turns it on.
	 */
	private static boolean enabled = false;

	public static void setEnabled(boolean value)
	{
		enabled = value;
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Parsed %d statements").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			System.out.println("[DEBUG] " + String.format(format, args));
		}
	}
}
