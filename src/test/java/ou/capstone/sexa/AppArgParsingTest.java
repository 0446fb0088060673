package ou.capstone.sexa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import ou.capstone.sexa.value.Angle;
import ou.capstone.sexa.value.RightAscension;
import ou.capstone.sexa.value.Time;
import ou.capstone.sexa.value.ValueKind;

public class AppArgParsingTest
{
    @Test
    public void testMissingValueThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            // a kind alone does not say which value to format
            final String[] params = { "--kind", "ra" };
            App.main( params );
        } );
    }

    @Test
    public void testRadAndComponentsTogetherThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--rad", "1", "--components", "1", "2", "3" };
            App.main( params );
        } );
    }

    @Test
    public void testMissingRadArgThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--rad" };
            App.main( params );
        } );
    }

    @Test
    public void testTooFewComponentsThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "-c", "23", "26" };
            App.main( params );
        } );
    }

    @Test
    public void testUnknownOptionThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--bogus" };
            App.main( params );
        } );
    }

    @Test
    public void testNoArgs() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = {};
        App.main( params );
        // Should just print help and exit with return code of zero
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testHelp() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = { "--help" };
        App.main( params );
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testValidComponentsExitsZero() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = { "--components", "23", "26", "44", "--format", "%.2m" };
        App.main( params );
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testTableExitsZero() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = { "-k", "ra", "-r", "2.42", "--table", "--ascii" };
        App.main( params );
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testOverflowExitsOne() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = { "--components", "4423", "26", "44", "--format", "%03s" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testBadVerbExitsOne() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = { "--rad", "1", "--format", "%q" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testNegativeRightAscensionExitsOne() throws Exception
    {
        App.ExitHandler exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        final String[] params = { "-k", "ra", "-n", "-c", "1", "2", "3" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testParseKind()
    {
        assertEquals( ValueKind.ANGLE, App.parseKind( "Angle" ) );
        assertEquals( ValueKind.HOUR_ANGLE, App.parseKind( "hour-angle" ) );
        assertEquals( ValueKind.RIGHT_ASCENSION, App.parseKind( " ra " ) );
        assertEquals( ValueKind.TIME, App.parseKind( "time" ) );
        assertThrows( IllegalArgumentException.class, () -> App.parseKind( "parsec" ) );
    }

    @Test
    public void testValueConstruction()
    {
        assertEquals( Angle.fromDms( true, 13, 47, 22 ),
                App.fromComponents( ValueKind.ANGLE, true, new String[] { "13", "47", "22" } ) );
        assertEquals( Time.fromSec( 90 ), App.fromRaw( ValueKind.TIME, 90 ) );
        assertTrue( App.fromRaw( ValueKind.RIGHT_ASCENSION, -1 ) instanceof RightAscension );
        assertThrows( IllegalArgumentException.class,
                () -> App.fromComponents( ValueKind.ANGLE, false, new String[] { "x", "0", "0" } ) );
    }
}
