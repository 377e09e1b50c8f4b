package com.phillippitts.speakstream.service.insertion;

import java.awt.AWTException;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.Locale;

/**
 * Synthesized key presses; backed by {@link Robot} in production.
 */
interface KeyboardDriver {

    void keyPress(int keyCode);

    void keyRelease(int keyCode);

    void delay(int ms);

    static KeyboardDriver robot() throws AWTException {
        Robot robot = new Robot();
        return new KeyboardDriver() {
            @Override
            public void keyPress(int keyCode) {
                robot.keyPress(keyCode);
            }

            @Override
            public void keyRelease(int keyCode) {
                robot.keyRelease(keyCode);
            }

            @Override
            public void delay(int ms) {
                robot.delay(ms);
            }
        };
    }

    /**
     * Sends the paste shortcut.
     *
     * @param mode os-default, META+V or CONTROL+V
     */
    static void sendPaste(KeyboardDriver keys, String mode) {
        boolean mac = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
        int modifier = mac ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
        if ("META+V".equalsIgnoreCase(mode)) {
            modifier = KeyEvent.VK_META;
        } else if ("CONTROL+V".equalsIgnoreCase(mode)) {
            modifier = KeyEvent.VK_CONTROL;
        }
        keys.keyPress(modifier);
        keys.keyPress(KeyEvent.VK_V);
        keys.keyRelease(KeyEvent.VK_V);
        keys.keyRelease(modifier);
    }
}
